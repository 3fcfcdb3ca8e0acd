package io.github.cyfko.typetrace;

import com.google.testing.compile.Compilation;
import com.google.testing.compile.Compiler;
import com.google.testing.compile.JavaFileObjects;
import io.github.cyfko.typetrace.processor.TypeNameProcessor;
import org.junit.jupiter.api.Test;

import javax.tools.JavaFileObject;
import java.io.IOException;
import java.util.stream.IntStream;

import static com.google.testing.compile.CompilationSubject.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Compiles small sources with the TypeNameProcessor and checks the generated index or the
 * reported errors.
 */
class TypeNameProcessorTest {

    private static final String INDEX = "io.github.cyfko.typetrace.providers.TypeNameProviderImpl";

    @Test
    void testIndexCoversClassesRecordsAndEnums() throws IOException {
        Compilation compilation = compile(
                source("Money", "@TypeName(\"Money\")", "public class Money {}"),
                source("Point", "@TypeName(\"geo.Point\")", "public record Point(double x, double y) {}"),
                source("Currency", "@TypeName(\"Currency_v1\")", "public enum Currency { EUR, XAF }"));

        assertThat(compilation).succeeded();

        String index = generatedIndex(compilation);
        assertTrue(index.contains("public final class TypeNameProviderImpl implements TypeNameProvider"));
        assertTrue(index.contains("@Generated(\"io.github.cyfko.typetrace.processor.TypeNameProcessor\")"));
        assertTrue(index.contains("Map.entry(io.github.cyfko.example.Money.class, \"Money\")"));
        assertTrue(index.contains("Map.entry(io.github.cyfko.example.Point.class, \"geo.Point\")"));
        assertTrue(index.contains("Map.entry(io.github.cyfko.example.Currency.class, \"Currency_v1\")"));
    }

    @Test
    void testNestedTypeIsReferencedByCanonicalName() throws IOException {
        Compilation compilation = compile(source("Outer",
                "public class Outer {",
                "    @TypeName(\"Inner\")",
                "    public static class Inner {}",
                "}"));

        assertThat(compilation).succeeded();
        assertTrue(generatedIndex(compilation)
                .contains("Map.entry(io.github.cyfko.example.Outer.Inner.class, \"Inner\")"));
    }

    @Test
    void testSharedNameIsReportedOnEveryDeclaration() {
        Compilation compilation = compile(
                source("Money", "@TypeName(\"Amount\")", "public class Money {}"),
                source("Price", "@TypeName(\"Amount\")", "public class Price {}"));

        assertThat(compilation).failed();
        assertThat(compilation).hadErrorCount(3);
        assertThat(compilation).hadErrorContaining(
                "@TypeName(\"Amount\") is declared on more than one type: "
                        + "io.github.cyfko.example.Money, io.github.cyfko.example.Price");
        assertThat(compilation).hadErrorContaining("No display name index generated");
        assertTrue(compilation.generatedSourceFile(INDEX).isEmpty());
    }

    @Test
    void testNameWithTypeArgumentsIsRejected() {
        Compilation compilation = compile(source("Box", "@TypeName(\"Box<T>\")", "public class Box<T> {}"));

        assertThat(compilation).failed();
        assertThat(compilation).hadErrorContaining(
                "Invalid @TypeName 'Box<T>': allowed characters are letters, digits, '.', '_' and '$'");
    }

    @Test
    void testBlankNameIsRejected() {
        Compilation compilation = compile(source("Blank", "@TypeName(\"   \")", "public class Blank {}"));

        assertThat(compilation).failed();
        assertThat(compilation).hadErrorContaining("@TypeName needs a non-blank name");
    }

    @Test
    void testInterfaceIsRejected() {
        Compilation compilation = compile(source("Contract", "@TypeName(\"Contract\")", "public interface Contract {}"));

        assertThat(compilation).failed();
        assertThat(compilation).hadErrorContaining(
                "@TypeName applies to classes, enums and records only, not to interface");
    }

    @Test
    void testPrivateNestedTypeIsRejected() {
        Compilation compilation = compile(source("Holder",
                "public class Holder {",
                "    @TypeName(\"Hidden\")",
                "    private static class Hidden {}",
                "}"));

        assertThat(compilation).failed();
        assertThat(compilation).hadErrorContaining("local, anonymous and private types are rejected");
    }

    @Test
    void testTypeInsidePrivateTypeIsRejected() {
        Compilation compilation = compile(source("Shell",
                "public class Shell {",
                "    private static class Layer {",
                "        @TypeName(\"Core\")",
                "        public static class Core {}",
                "    }",
                "}"));

        assertThat(compilation).failed();
        assertThat(compilation).hadErrorContaining("local, anonymous and private types are rejected");
    }

    @Test
    void testEveryDeclarationIsIndexed() throws IOException {
        JavaFileObject[] sources = IntStream.range(0, 15)
                .mapToObj(i -> source("Class" + i, "@TypeName(\"Name" + i + "\")", "public class Class" + i + " {}"))
                .toArray(JavaFileObject[]::new);

        Compilation compilation = compile(sources);

        assertThat(compilation).succeeded();
        String index = generatedIndex(compilation);
        for (int i = 0; i < 15; i++) {
            assertTrue(index.contains("Class" + i + ".class, \"Name" + i + "\""), "Missing entry for Name" + i);
        }
        assertThat(compilation).hadNoteContaining("Indexed 15 display name(s) in " + INDEX);
    }

    @Test
    void testNoDeclarationWritesNoIndex() {
        Compilation compilation = compile(JavaFileObjects.forSourceLines(
                "io.github.cyfko.example.Plain",
                "package io.github.cyfko.example;",
                "",
                "public class Plain {}"));

        assertThat(compilation).succeeded();
        assertTrue(compilation.generatedSourceFile(INDEX).isEmpty());
    }

    // ==================== Helper Methods ====================

    private static Compilation compile(JavaFileObject... sources) {
        return Compiler.javac()
                .withProcessors(new TypeNameProcessor())
                .compile(sources);
    }

    /**
     * A source file of package {@code io.github.cyfko.example} importing {@link TypeName}.
     */
    private static JavaFileObject source(String simpleName, String... body) {
        String[] lines = new String[body.length + 3];
        lines[0] = "package io.github.cyfko.example;";
        lines[1] = "";
        lines[2] = "import io.github.cyfko.typetrace.TypeName;";
        System.arraycopy(body, 0, lines, 3, body.length);
        return JavaFileObjects.forSourceLines("io.github.cyfko.example." + simpleName, lines);
    }

    private static String generatedIndex(Compilation compilation) throws IOException {
        return compilation
                .generatedSourceFile(INDEX)
                .orElseThrow(() -> new AssertionError("Generated TypeNameProviderImpl not found"))
                .getCharContent(true)
                .toString();
    }
}
