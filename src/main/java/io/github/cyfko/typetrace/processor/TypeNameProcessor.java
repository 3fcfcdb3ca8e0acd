package io.github.cyfko.typetrace.processor;

import com.google.auto.service.AutoService;
import io.github.cyfko.typetrace.TypeName;

import javax.annotation.processing.*;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.*;
import javax.tools.Diagnostic;
import java.io.IOException;
import java.io.Writer;
import java.util.*;
import java.util.regex.Pattern;

/**
 * Builds the display name index from {@link TypeName} declarations.
 * <p>
 * Each annotated type is checked as soon as its round is processed:
 * <ul>
 *     <li>it is a class, an enum or a record;</li>
 *     <li>generated code can name it: it is not local, anonymous or private, and neither is any
 *     type enclosing it;</li>
 *     <li>its name is not blank and only uses letters, digits, '.', '_' and '$'.</li>
 * </ul>
 * Names must be unique across the compilation; clashes are reported on every declaration
 * involved once all rounds are done.
 * <p>
 * When at least one declaration was accepted and nothing was rejected, the final round writes
 * {@code io.github.cyfko.typetrace.providers.TypeNameProviderImpl}. Any error fails the
 * compilation and no index is written.
 */
@AutoService(Processor.class)
@SupportedAnnotationTypes("io.github.cyfko.typetrace.TypeName")
public final class TypeNameProcessor extends AbstractProcessor {

    static final String PROVIDER_PACKAGE = "io.github.cyfko.typetrace.providers";
    static final String PROVIDER_NAME = "TypeNameProviderImpl";

    private static final Pattern NAME_SYNTAX = Pattern.compile("[A-Za-z0-9._$]+");

    /** Accepted declarations in discovery order. */
    private final Map<TypeElement, String> declared = new LinkedHashMap<>();
    private boolean rejected;

    @Override
    public SourceVersion getSupportedSourceVersion() {
        return SourceVersion.latestSupported();
    }

    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment env) {
        for (Element element : env.getElementsAnnotatedWith(TypeName.class)) {
            String problem = problemWith(element);
            if (problem != null) {
                error(problem, element);
                rejected = true;
            } else {
                declared.put((TypeElement) element, element.getAnnotation(TypeName.class).value());
            }
        }

        if (!env.processingOver()) {
            return true;
        }

        rejected |= reportClashes();
        if (rejected) {
            error("No display name index generated: fix the @TypeName errors reported above", null);
        } else if (!declared.isEmpty()) {
            writeIndex();
        }
        return true;
    }

    /** Returns why {@code element} cannot be indexed, or {@code null} if it can. */
    private String problemWith(Element element) {
        if (!element.getKind().isClass()) {
            return "@TypeName applies to classes, enums and records only, not to "
                    + element.getKind().name().toLowerCase(Locale.ROOT).replace('_', ' ');
        }
        if (!nameableFromGeneratedCode((TypeElement) element)) {
            return "@TypeName needs a type the generated index can reference; "
                    + "local, anonymous and private types are rejected";
        }

        String name = element.getAnnotation(TypeName.class).value();
        if (name.isBlank()) {
            return "@TypeName needs a non-blank name";
        }
        if (!NAME_SYNTAX.matcher(name).matches()) {
            return "Invalid @TypeName '" + name + "': allowed characters are letters, digits, '.', '_' and '$'";
        }
        return null;
    }

    private static boolean nameableFromGeneratedCode(TypeElement type) {
        for (Element e = type; e instanceof TypeElement; e = e.getEnclosingElement()) {
            NestingKind nesting = ((TypeElement) e).getNestingKind();
            if (nesting == NestingKind.LOCAL || nesting == NestingKind.ANONYMOUS
                    || e.getModifiers().contains(Modifier.PRIVATE)) {
                return false;
            }
        }
        return true;
    }

    /** Reports every declaration sharing its name with another one. */
    private boolean reportClashes() {
        Map<String, List<TypeElement>> byName = new LinkedHashMap<>();
        declared.forEach((type, name) -> byName.computeIfAbsent(name, k -> new ArrayList<>()).add(type));

        boolean clash = false;
        for (Map.Entry<String, List<TypeElement>> group : byName.entrySet()) {
            List<TypeElement> types = group.getValue();
            if (types.size() < 2) continue;

            StringJoiner owners = new StringJoiner(", ");
            types.forEach(type -> owners.add(type.getQualifiedName()));
            for (TypeElement type : types) {
                error("@TypeName(\"" + group.getKey() + "\") is declared on more than one type: " + owners, type);
            }
            clash = true;
        }
        return clash;
    }

    private void writeIndex() {
        String qualifiedName = PROVIDER_PACKAGE + "." + PROVIDER_NAME;
        try (Writer out = processingEnv.getFiler()
                .createSourceFile(qualifiedName, declared.keySet().toArray(new Element[0]))
                .openWriter()) {
            out.write(indexSource());
        } catch (IOException e) {
            error("Cannot write " + qualifiedName + ": " + e.getMessage(), null);
            return;
        }

        processingEnv.getMessager().printMessage(Diagnostic.Kind.NOTE,
                "Indexed " + declared.size() + " display name(s) in " + qualifiedName);
    }

    /** Names are restricted to {@link #NAME_SYNTAX}, so they need no escaping. */
    private String indexSource() {
        StringJoiner entries = new StringJoiner(",\n");
        declared.forEach((type, name) ->
                entries.add("            Map.entry(" + type.getQualifiedName() + ".class, \"" + name + "\")"));

        return """
                package %s;

                import java.util.Map;
                import javax.annotation.processing.Generated;

                @Generated("%s")
                public final class %s implements TypeNameProvider {

                    private static final Map<Class<?>, String> DISPLAY_NAMES = Map.ofEntries(
                %s
                    );

                    @Override
                    public Map<Class<?>, String> getDisplayNames() {
                        return DISPLAY_NAMES;
                    }
                }
                """.formatted(PROVIDER_PACKAGE, TypeNameProcessor.class.getName(), PROVIDER_NAME, entries);
    }

    private void error(String message, Element element) {
        processingEnv.getMessager().printMessage(Diagnostic.Kind.ERROR, message, element);
    }
}
