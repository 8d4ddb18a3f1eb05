package co.fanki.cdnmirror.fetch.domain;

import co.fanki.cdnmirror.shared.ErrorCode;
import co.fanki.cdnmirror.shared.MirrorException;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for ImportScanner.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ImportScannerTest {

    private static final ImportScanner SCANNER = new ImportScanner();

    @AfterAll
    static void closeScanner() {
        SCANNER.close();
    }

    @Test
    void whenScanning_givenEveryImportForm_shouldFindThemInOrder() {
        final String source = """
                import React from "react";
                import {a, b as c} from './x.mjs';
                import * as ns from "/ns@1.0.0";
                export * from "../re.mjs";
                export {d} from "./d.mjs";
                import "./side.mjs";
                const m = import("./lazy.mjs");
                """;

        final ScannedModule module = SCANNER.scan(source);

        assertEquals(List.of("react", "./x.mjs", "/ns@1.0.0", "../re.mjs",
                "./d.mjs", "./side.mjs", "./lazy.mjs"), module.specifiers());
        assertEquals(List.of(
                ImportSpecifier.Kind.STATIC, ImportSpecifier.Kind.STATIC,
                ImportSpecifier.Kind.STATIC, ImportSpecifier.Kind.RE_EXPORT,
                ImportSpecifier.Kind.RE_EXPORT, ImportSpecifier.Kind.BARE,
                ImportSpecifier.Kind.DYNAMIC), module.imports().stream()
                        .map(ImportSpecifier::kind).toList());
        assertEquals(List.of("../re.mjs", "./d.mjs"),
                module.reExportSources());
    }

    @Test
    void whenScanning_givenImportTextInStringsAndComments_shouldIgnoreIt() {
        final String source = """
                const s = "import x from 'fake'";
                // import y from "commented"
                /* export * from "block" */
                const t = `import z from "tpl" ${ await import("./real.mjs") }`;
                """;

        assertEquals(List.of("./real.mjs"),
                SCANNER.scan(source).specifiers());
    }

    @Test
    void whenScanning_givenRegexAndDivision_shouldTellThemApart() {
        final String source = """
                const r = /import "x"/g; const d = a / b / c;
                import y from "./y.mjs";
                """;

        assertEquals(List.of("./y.mjs"), SCANNER.scan(source).specifiers());
    }

    @Test
    void whenScanning_givenMemberCallNamedImport_shouldIgnoreIt() {
        assertTrue(SCANNER.scan("loader.import(\"./x.mjs\");").isEmpty());
    }

    @Test
    void whenScanning_givenDataUrlOrTemplateArgument_shouldIgnoreThem() {
        final String source = """
                import "data:text/javascript,export default 1";
                import(`./${name}.mjs`);
                """;

        assertTrue(SCANNER.scan(source).isEmpty());
    }

    @Test
    void whenScanning_givenTypeOnlyImports_shouldFindThem() {
        final String source = """
                import type { Props } from "./types";
                export type { X } from "./x";
                export default function f() { return 1; }
                """;

        assertEquals(List.of("./types", "./x"),
                SCANNER.scan(source).specifiers());
    }

    @Test
    void whenScanning_givenJsxAttribute_shouldNotMatchInsideIt() {
        final String source = "import a from \"./a.mjs\";\n"
                + "const el = <div title=\"import y from 'z'\">{a}</div>;";

        assertEquals(List.of("./a.mjs"), SCANNER.scan(source).specifiers());
    }

    @Test
    void whenScanning_givenSpecifier_shouldReportOffsetsInsideQuotes() {
        final String source = "#!/usr/bin/env node\n"
                + "import a from \"./a.mjs\"; import b from './a.mjs';";

        final List<ImportSpecifier> imports = SCANNER.scan(source).imports();

        assertEquals(2, imports.size());
        for (final ImportSpecifier specifier : imports) {
            assertEquals("./a.mjs", source.substring(specifier.start(),
                    specifier.end()));
            assertTrue(specifier.isRelative());
        }
        assertEquals(List.of("./a.mjs"), SCANNER.scan(source).specifiers());
    }

    @Test
    void whenScanning_givenImportTextInJsxChild_shouldIgnoreIt() {
        final String source =
                "const el = <p>To use it, import x from \"./evil.mjs\" first</p>;";

        assertTrue(SCANNER.scan(source).isEmpty());
    }

    @Test
    void whenScanning_givenApostropheInJsxChild_shouldFindLaterImport() {
        final String source = "<p>Don't</p>;import(\"./lazy.mjs\");";

        final ScannedModule module = SCANNER.scan(source);

        assertEquals(List.of("./lazy.mjs"), module.specifiers());
        assertEquals(ImportSpecifier.Kind.DYNAMIC,
                module.imports().get(0).kind());
    }

    @Test
    void whenScanning_givenRegexAfterParenthesis_shouldFindLaterImport() {
        final String source = "if(ok)/[\"']/.test(s);import \"./real.mjs\";";

        assertEquals(List.of("./real.mjs"),
                SCANNER.scan(source).specifiers());
    }

    @Test
    void whenScanning_givenRegexAfterBlock_shouldIgnoreItsContent() {
        final String source = """
                {}
                /import "./fake.mjs"/.test(s);
                import "./real.mjs";
                """;

        assertEquals(List.of("./real.mjs"),
                SCANNER.scan(source).specifiers());
    }

    @Test
    void whenScanning_givenMinifiedLine_shouldFindOnlyRealImports() {
        final String source = "import{a as b}from\"./a.mjs\";"
                + "const c=<p>it's \"import y from './y.mjs'\"</p>;"
                + "if(b)/'/.test(c);export*from\"./e.mjs\";";

        final ScannedModule module = SCANNER.scan(source);

        assertEquals(List.of("./a.mjs", "./e.mjs"), module.specifiers());
        assertEquals(List.of(ImportSpecifier.Kind.STATIC,
                ImportSpecifier.Kind.RE_EXPORT), module.imports().stream()
                        .map(ImportSpecifier::kind).toList());
        for (final ImportSpecifier specifier : module.imports()) {
            assertEquals(specifier.value(), source.substring(
                    specifier.start(), specifier.end()));
        }
    }

    @Test
    void whenScanning_givenUnparseableSource_shouldFailStructurally() {
        final MirrorException e = assertThrows(MirrorException.class,
                () -> SCANNER.scan("import x from"));

        assertEquals(ErrorCode.STRUCTURAL_INCONSISTENCY, e.getErrorCode());
    }

    @Test
    void whenScanning_givenEmptySource_shouldReturnEmptyModule() {
        assertTrue(SCANNER.scan("").isEmpty());
        assertTrue(SCANNER.scan(null).isEmpty());
    }

}
