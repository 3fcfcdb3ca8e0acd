package io.github.cyfko.typetrace;

import io.github.cyfko.typetrace.cell.InstrumentedCell;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TypeSwitchTest {

    private final List<String> invoked = new ArrayList<>();
    private TypeSwitch<String> compileTimeCheck;

    @BeforeEach
    void buildTable() {
        invoked.clear();
        compileTimeCheck = TypeSwitch.<String>builder()
                .on(Integer.class, i -> record("int"))
                .on(Double.class, d -> record("double"))
                .on(new TypeCapture<InstrumentedCell<Float>>() {}.witness(), c -> record("InstrumentedCell<float>"))
                .orElse(v -> record("something else"));
    }

    private String record(String handler) {
        invoked.add(handler);
        return "Type at compile time is " + handler;
    }

    @Test
    void testRegisteredTypesSelectTheirHandler() {
        assertEquals("Type at compile time is int", compileTimeCheck.apply(42));
        assertEquals("Type at compile time is double", compileTimeCheck.apply(3.14));
        assertEquals("Type at compile time is InstrumentedCell<float>", compileTimeCheck.apply(InstrumentedCell.of(1.0f)));
        assertEquals(List.of("int", "double", "InstrumentedCell<float>"), invoked);
    }

    @Test
    void testUnregisteredTypeRunsDefaultExactlyOnce() {
        assertEquals("Type at compile time is something else", compileTimeCheck.apply("Hello"));
        assertEquals(List.of("something else"), invoked);
    }

    @Test
    void testMatchingIsExact() {
        // same raw class, other type argument
        compileTimeCheck.apply(InstrumentedCell.of(1.0d));
        // no widening from long to int
        compileTimeCheck.apply(42L);

        assertEquals(List.of("something else", "something else"), invoked);
        assertFalse(compileTimeCheck.handles(TypeWitness.of(int.class)));
        assertTrue(compileTimeCheck.handles(TypeWitness.of(Integer.class)));
    }

    @Test
    void testStaticWitnessOverridesRuntimeClass() {
        assertEquals("Type at compile time is something else",
                compileTimeCheck.apply(TypeWitness.of(Number.class), 42));
        assertEquals(List.of("something else"), invoked);
    }

    @Test
    void testDuplicateCaseIsRejected() {
        TypeSwitch.Builder<String> builder = TypeSwitch.<String>builder().on(Integer.class, i -> "a");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> builder.on(TypeWitness.of(Integer.class), i -> "b"));
        assertTrue(e.getMessage().contains("Integer"));
    }

    @Test
    void testNullValueIsRejected() {
        assertThrows(NullPointerException.class, () -> compileTimeCheck.apply(null));
    }
}
