package org.livedoc.compiler.diagnostics;

import org.livedoc.compiler.model.FileId;
import org.livedoc.compiler.model.Span;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LiveFileErrorTest {

    private static final FileId FILE = new FileId(0);

    @Test
    void computesLineColumnAndSnippet() {
        String source = "first\n  second line\nthird";

        LiveFileError error = LiveFileError.of("doc.json", source, new Span(FILE, 8, 14), "Bad thing");

        assertThat(error.line()).isEqualTo(2);
        assertThat(error.column()).isEqualTo(3);
        assertThat(error.snippet()).isEqualTo("  second line");
        assertThat(error.toString()).isEqualTo("doc.json:2:3 - Bad thing\n  second line\n  ^");
    }

    @Test
    void unknownSpanRendersWithoutPosition() {
        LiveFileError error = LiveFileError.of("doc.json", "text", null, "Lost");

        assertThat(error.line()).isZero();
        assertThat(error.toString()).isEqualTo("doc.json:0:0 - Lost");
    }

    @Test
    void liveErrorRendersAgainstSource() {
        LiveError error = LiveError.of(LiveErrorKind.SCOPE_RESOLUTION, LiveFileErrorTest.class,
                new Span(FILE, 0, 1), "Cannot find item on scope: x");

        LiveFileError rendered = error.toLiveFileError("doc.json", "x");

        assertThat(error.origin()).isEqualTo("LiveFileErrorTest");
        assertThat(rendered.message()).isEqualTo("Cannot find item on scope: x");
        assertThat(rendered.line()).isEqualTo(1);
        assertThat(rendered.column()).isEqualTo(1);
    }
}
