package co.fanki.codemap.analysis.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for NameOnlyCallResolver.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class NameOnlyCallResolverTest {

    private final NameOnlyCallResolver resolver = new NameOnlyCallResolver();

    @Test
    void whenResolving_givenCallToFunctionInOtherModule_shouldCreateEdge() {
        final ModuleRecord a = module("a.py", List.of("helper"), List.of());
        final ModuleRecord b = module("b.py", List.of("main"),
                List.of("helper"));

        final List<Edge> edges = resolver.resolve(List.of(a, b),
                index(a, b));

        assertEquals(List.of(new Edge("b.py", "a.py", "helper")), edges);
    }

    @Test
    void whenResolving_givenCallToOwnFunction_shouldNotCreateSelfEdge() {
        final ModuleRecord a = module("a.py", List.of("helper", "run"),
                List.of("helper"));

        final List<Edge> edges = resolver.resolve(List.of(a), index(a));

        assertTrue(edges.isEmpty());
    }

    @Test
    void whenResolving_givenDottedCall_shouldMatchOnLeadingSegment() {
        final ModuleRecord utils = module("utils.py", List.of("os"),
                List.of());
        final ModuleRecord app = module("app.py", List.of(),
                List.of("os.path.join", "print"));

        final List<Edge> edges = resolver.resolve(List.of(utils, app),
                index(utils, app));

        assertEquals(List.of(new Edge("app.py", "utils.py", "os.path.join")),
                edges);
    }

    @Test
    void whenResolving_givenUnknownAndBuiltinCalls_shouldIgnoreThem() {
        final ModuleRecord app = module("app.py", List.of(),
                List.of("len", "print", "json.dumps"));

        assertTrue(resolver.resolve(List.of(app), index(app)).isEmpty());
    }

    @Test
    void whenResolving_givenSeveralCalls_shouldKeepModuleThenCallOrder() {
        final ModuleRecord lib = module("lib.py", List.of("load", "save"),
                List.of());
        final ModuleRecord first = module("first.py", List.of(),
                List.of("save", "load"));
        final ModuleRecord second = module("second.py", List.of(),
                List.of("load"));

        final List<Edge> edges = resolver.resolve(
                List.of(lib, first, second), index(lib, first, second));

        assertEquals(List.of(
                new Edge("first.py", "lib.py", "save"),
                new Edge("first.py", "lib.py", "load"),
                new Edge("second.py", "lib.py", "load")), edges);
    }

    static ModuleRecord module(final String path, final List<String> defs,
            final List<String> calls) {
        final List<FunctionRecord> functions = defs.stream()
                .map(name -> new FunctionRecord(name, path, 1, 2, List.of(),
                        List.of(), ""))
                .toList();
        return ModuleRecord.parsed(path, functions, List.of(), List.of(),
                calls);
    }

    private static SymbolIndex index(final ModuleRecord... modules) {
        final SymbolIndex symbols = new SymbolIndex();
        for (final ModuleRecord module : modules) {
            symbols.registerAll(module);
        }
        return symbols;
    }

}
