package co.fanki.codemap.analysis.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for SymbolIndex.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class SymbolIndexTest {

    @Test
    void whenRegistering_givenSameNameTwice_shouldKeepLastOwner() {
        final SymbolIndex index = new SymbolIndex();

        index.register("run", "first.py");
        index.register("run", "second.py");

        assertEquals("second.py", index.owner("run").orElseThrow());
        assertEquals(1, index.size());
    }

    @Test
    void whenRegisteringAll_givenFailedModule_shouldRegisterNothing() {
        final SymbolIndex index = new SymbolIndex();

        index.registerAll(ModuleRecord.failed("bad.py",
                ModuleRecord.PARSE_ERROR));

        assertEquals(0, index.size());
    }

    @Test
    void whenLookingUp_givenUnknownName_shouldReturnEmpty() {
        final SymbolIndex index = new SymbolIndex();
        index.registerAll(NameOnlyCallResolverTest.module("a.py",
                List.of("helper"), List.of()));

        assertTrue(index.owner("missing").isEmpty());
        assertEquals("a.py", index.owner("helper").orElseThrow());
    }

    @Test
    void whenRegistering_givenBlankName_shouldThrowException() {
        final SymbolIndex index = new SymbolIndex();

        assertThrows(IllegalArgumentException.class,
                () -> index.register(" ", "a.py"));
    }

}
