package me.golemcore.conductor.adapter.outbound.sandbox;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourceValidatorTest {

    @Test
    void shouldAcceptAllowedModulesAndPlainCode() {
        String code = """
                const stats = require('stats');
                const data = [1, 2, 3];
                console.log(stats.mean(data));
                data.map(x => x * 2)
                """;

        assertTrue(SourceValidator.findViolation(code).isEmpty());
    }

    @Test
    void shouldRejectBlockedModule() {
        Optional<String> violation = SourceValidator.findViolation("const cp = require('child_process');");

        assertEquals("Import of 'child_process' is not allowed: blocked module (line 1)", violation.orElseThrow());
    }

    @Test
    void shouldRejectUnknownModuleAndListAllowedOnes() {
        String violation = SourceValidator.findViolation("\nrequire(\"lodash\")").orElseThrow();

        assertEquals("Import of 'lodash' is not allowed. Available modules: encoding, figures, files, stats"
                + " (line 2)", violation);
    }

    @Test
    void shouldRejectNodePrefixedModule() {
        assertTrue(SourceValidator.findViolation("import fs from 'node:fs';").orElseThrow()
                .contains("blocked module"));
    }

    @Test
    void shouldRejectDynamicRequireAndImport() {
        assertTrue(SourceValidator.findViolation("const m = 'fs'; require(m);").orElseThrow()
                .startsWith("Dynamic require()"));
        assertTrue(SourceValidator.findViolation("import('stats').then(x => x)").orElseThrow()
                .startsWith("Dynamic import()"));
    }

    @Test
    void shouldRejectEvaluationPrimitives() {
        assertTrue(SourceValidator.findViolation("eval('1+1')").isPresent());
        assertTrue(SourceValidator.findViolation("new Function('return 1')()").isPresent());
        assertTrue(SourceValidator.findViolation("[].constructor.constructor('return this')()").isPresent());
    }

    @Test
    void shouldRejectHostEscapeIdentifiers() {
        assertEquals("Access to 'Java' is not allowed (line 1)",
                SourceValidator.findViolation("Java.type('java.lang.Runtime')").orElseThrow());
        assertTrue(SourceValidator.findViolation("Polyglot.eval('js', '1')").isPresent());
        assertTrue(SourceValidator.findViolation("({}).__proto__").isPresent());
    }

    @Test
    void shouldAllowDeniedNamesAsPropertiesStringsAndComments() {
        String code = """
                // eval() and require('fs') in a comment are harmless
                const text = "call eval or require('os') in a string";
                const obj = { exit: 1 };
                obj.eval = 2;
                obj.exit + obj.eval
                """;

        assertTrue(SourceValidator.findViolation(code).isEmpty());
    }

    @Test
    void shouldNotMistakeDivisionForRegex() {
        assertTrue(SourceValidator.findViolation("const a = 10 / 2 / 5; const r = /eval/.test('x'); a").isEmpty());
    }

    @Test
    void shouldReportUnterminatedString() {
        assertTrue(SourceValidator.findViolation("const s = 'oops").orElseThrow()
                .startsWith("Unterminated string literal"));
    }

    @Test
    void shouldTolerateNullSource() {
        assertTrue(SourceValidator.findViolation(null).isEmpty());
    }
}
