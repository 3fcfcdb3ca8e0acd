package io.github.cyfko.typetrace.container;

import io.github.cyfko.typetrace.TypeIdentity;
import io.github.cyfko.typetrace.TypeWitness;
import io.github.cyfko.typetrace.cell.InstrumentedCell;
import io.github.cyfko.typetrace.fixtures.Gauge;
import io.github.cyfko.typetrace.model.ConstructionEvent;
import io.github.cyfko.typetrace.model.ConstructionEvent.Kind;
import io.github.cyfko.typetrace.trace.Diagnostics;
import io.github.cyfko.typetrace.trace.DiagnosticsSink;
import io.github.cyfko.typetrace.trace.RecordingSink;
import io.github.cyfko.typetrace.trace.TraceLog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DynamicArrayTest {

    private static final TypeWitness<Double> DOUBLE = TypeWitness.of(Double.class);

    private int mark;

    @BeforeEach
    void markTraceLog() {
        mark = TraceLog.global().size();
    }

    private List<ConstructionEvent> traced() {
        return TraceLog.global().since(mark);
    }

    @Test
    void testEmpty() {
        DynamicArray<String> array = DynamicArray.empty();

        assertTrue(array.isEmpty());
        assertEquals(Strategy.EMPTY, array.strategy());
        assertTrue(traced().isEmpty());
    }

    @Test
    void testSizedDefaultHoldsDefaultsWithoutTrace() {
        for (int n : new int[]{0, 1, 7}) {
            DynamicArray<Double> doubles = DynamicArray.ofSize(n, Double.class);
            DynamicArray<String> strings = DynamicArray.ofSize(n, String.class);

            assertEquals(n, doubles.size());
            assertEquals(n, strings.size());
            doubles.forEach(d -> assertEquals(0.0d, d));
            strings.forEach(s -> assertEquals("", s));
        }
        assertTrue(traced().isEmpty());
    }

    @Test
    void testSizedDefaultCreatesOneInstancePerSlot() {
        DynamicArray<Gauge> gauges = DynamicArray.ofSize(2, Gauge.class);

        assertNotSame(gauges.get(0), gauges.get(1));
    }

    @Test
    void testSizedFillTracesValueThenCopyPerElement() {
        DynamicArray<InstrumentedCell<Double>> array = DynamicArray.filled(5, 1.3);

        assertEquals(5, array.size());
        assertEquals(Strategy.SIZED_FILL, array.strategy());
        assertSame(InstrumentedCell.witnessFor(DOUBLE), array.elementType());
        for (InstrumentedCell<Double> cell : array) {
            assertEquals(1.3, cell.get());
        }

        List<ConstructionEvent> events = traced();
        assertEquals(10, events.size());
        for (int i = 0; i < events.size(); i += 2) {
            assertEquals(new ConstructionEvent(Kind.VALUE_INIT, "Double", "1.3"), events.get(i));
            assertEquals(new ConstructionEvent(Kind.COPY, "Double", "1.3"), events.get(i + 1));
        }
    }

    @Test
    void testSizedDefaultOfEnumHoldsFirstConstant() {
        DynamicArray<Gauge.Unit> units = DynamicArray.ofSize(2, Gauge.Unit.class);

        assertEquals(List.of(Gauge.Unit.BAR, Gauge.Unit.BAR), units.getElements());
    }

    @Test
    void testFilledCellsDoNotShareMutableValue() {
        Gauge gauge = new Gauge();
        DynamicArray<InstrumentedCell<Gauge>> array = DynamicArray.filled(2, gauge);

        array.get(0).get().setReading(42);
        gauge.setReading(7);

        assertEquals(0, array.get(0).get().getReading());
        assertEquals(0, array.get(1).get().getReading());
        assertEquals(7, gauge.getReading());
    }

    @Test
    void testInitializerListMarkerOnlyForBracedLists() {
        RecordingSink sink = new RecordingSink();
        DiagnosticsSink original = Diagnostics.install(sink);
        try {
            DynamicArray.braced(10, 1.3);
            DynamicArray.filled(10, 1.3);
            DynamicArray.ofSize(3, Double.class);
            DynamicArray.empty();
            assertEquals(List.of("DynamicArray<InstrumentedCell<Double>>"), sink.initializerLists);

            DynamicArray.listOf(Double.class, 10.0, 1.3);
            DynamicArray.cellsOf(InstrumentedCell.of(1.5f));
            assertEquals(List.of(
                    "DynamicArray<InstrumentedCell<Double>>",
                    "DynamicArray<Double>",
                    "DynamicArray<InstrumentedCell<Float>>"
            ), sink.initializerLists);
        } finally {
            Diagnostics.install(original);
        }
    }

    @Test
    void testSizedFillOfZeroTracesNothing() {
        DynamicArray<InstrumentedCell<String>> array = DynamicArray.filled(0, "x");

        assertTrue(array.isEmpty());
        assertTrue(traced().isEmpty());
    }

    @Test
    void testBracedScalarsAreNotWrapped() {
        DynamicArray<?> single = DynamicArray.braced(0);
        DynamicArray<?> doubles = DynamicArray.braced(10.0, 1.3);

        assertEquals(List.of(0), single.getElements());
        assertSame(TypeWitness.of(Integer.class), single.elementType());

        assertEquals(List.of(10.0, 1.3), doubles.getElements());
        assertSame(DOUBLE, doubles.elementType());
        assertFalse(doubles.resolution().wrapped());

        assertTrue(traced().isEmpty());
    }

    @Test
    void testListOfKeepsDeclaredType() {
        DynamicArray<Double> array = DynamicArray.listOf(Double.class, 1.0, 2.0, 3.0);

        assertEquals(List.of(1.0, 2.0, 3.0), array.getElements());
        assertEquals(Strategy.LIST, array.strategy());
        assertTrue(traced().isEmpty());
    }

    @Test
    void testBracedCountAndValueYieldsTwoCellsNotTen() {
        DynamicArray<?> array = DynamicArray.braced(10, 1.3);

        assertEquals(2, array.size());
        assertEquals(Strategy.LIST, array.strategy());
        assertSame(InstrumentedCell.witnessFor(DOUBLE), array.elementType());

        DynamicArray<InstrumentedCell<Double>> cells = array.as(InstrumentedCell.witnessFor(DOUBLE));
        assertEquals(10.0, cells.get(0).get());
        assertEquals(1.3, cells.get(1).get());

        assertEquals(List.of(
                new ConstructionEvent(Kind.VALUE_INIT, "Double", "10.0"),
                new ConstructionEvent(Kind.VALUE_INIT, "Double", "1.3")
        ), traced());
    }

    @Test
    void testBracedCellsAreCopiedNotRewrapped() {
        InstrumentedCell<Double> a = InstrumentedCell.of(10.34);
        InstrumentedCell<Double> b = InstrumentedCell.of(9.23);
        InstrumentedCell<Double> c = InstrumentedCell.of(3.14);
        int afterCells = TraceLog.global().size();

        DynamicArray<InstrumentedCell<Double>> array = DynamicArray.cellsOf(a, b, c);

        assertEquals(Strategy.LIST_OF_CELLS, array.strategy());
        assertSame(InstrumentedCell.witnessFor(DOUBLE), array.elementType());
        List<Double> held = new ArrayList<>();
        array.forEach(cell -> held.add(cell.get()));
        assertEquals(List.of(10.34, 9.23, 3.14), held);
        assertNotSame(a, array.get(0));

        List<ConstructionEvent> copies = TraceLog.global().since(afterCells);
        assertEquals(3, copies.size());
        assertTrue(copies.stream().allMatch(e -> e.kind() == Kind.COPY && e.typeName().equals("Double")));
    }

    @Test
    void testUntypedBracedCellsMatchTypedFactory() {
        DynamicArray<?> array = DynamicArray.braced(InstrumentedCell.of(1.5f), InstrumentedCell.of(2.5f));

        assertEquals(Strategy.LIST_OF_CELLS, array.strategy());
        assertEquals("InstrumentedCell<Float>", TypeIdentity.displayName(array.elementType()));
    }

    @Test
    void testElementsAreReadOnly() {
        DynamicArray<Double> array = DynamicArray.listOf(Double.class, 1.0);

        assertThrows(UnsupportedOperationException.class, () -> array.getElements().add(2.0));
    }

    @Test
    void testNarrowingToWrongTypeFails() {
        DynamicArray<?> array = DynamicArray.braced(10, 1.3);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> array.as(Double.class));
        assertTrue(e.getMessage().contains("InstrumentedCell<Double>"));
    }

    @Test
    void testAmbiguousBracedListIsRejectedWithoutTrace() {
        assertThrows(AmbiguousCallShapeException.class, () -> DynamicArray.braced(10, 1.3, 2.5));
        assertTrue(traced().isEmpty());
    }

    @Test
    void testNegativeSizeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> DynamicArray.ofSize(-1, Double.class));
        assertThrows(IllegalArgumentException.class, () -> DynamicArray.filled(-1, 1.3));
        assertTrue(traced().isEmpty());
    }

    @Test
    void testConstructFromCall() {
        DynamicArray<?> array = DynamicArray.construct(ConstructionCall.parenthesized(3, "x"));

        assertEquals(Strategy.SIZED_FILL, array.strategy());
        assertEquals(6, traced().size());
        assertEquals("DynamicArray<InstrumentedCell<String>>[InstrumentedCell<String>[x], "
                + "InstrumentedCell<String>[x], InstrumentedCell<String>[x]]", array.toString());
    }
}
