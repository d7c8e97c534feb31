package org.livedoc.compiler.frontend.io;

import org.livedoc.compiler.diagnostics.LiveParseException;
import org.livedoc.compiler.document.LiveDocument;
import org.livedoc.compiler.document.LiveNode;
import org.livedoc.compiler.document.LiveValue;
import org.livedoc.compiler.model.FileId;
import org.livedoc.compiler.model.IdPack;
import org.livedoc.compiler.model.LiveId;
import org.livedoc.compiler.model.TokenWithSpan;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Unit tests for {@link JsonLiveParser}.
 */
@Tag("unit")
class JsonLiveParserTest {

    private static final FileId FILE = new FileId(4);

    private final JsonLiveParser parser = new JsonLiveParser();

    private LiveDocument parse(String source) throws LiveParseException {
        return parser.parse(FILE, "test.json", source);
    }

    @Test
    void parsesPrimitives() throws Exception {
        LiveDocument doc = parse("""
                {"on": true, "count": 42, "ratio": 1.5, "title": "hi"}
                """);

        assertThat(doc.level(0)).extracting(LiveNode::idPack)
                .containsExactly(IdPack.single("on"), IdPack.single("count"), IdPack.single("ratio"), IdPack.single("title"));
        assertThat(doc.node(0, 0).value()).isEqualTo(new LiveValue.BoolValue(true));
        assertThat(doc.node(0, 1).value()).isEqualTo(new LiveValue.IntValue(42));
        assertThat(doc.node(0, 2).value()).isEqualTo(new LiveValue.FloatValue(1.5));
        assertThat(doc.string((LiveValue.StringValue) doc.node(0, 3).value())).isEqualTo("hi");
    }

    @Test
    void recordsOneTokenPerNodeWithSourceOffsets() throws Exception {
        LiveDocument doc = parse("{\"x\": 1}");

        TokenWithSpan token = doc.token(0);
        assertThat(token.text()).isEqualTo("x");
        assertThat(token.span().fileId()).isEqualTo(FILE);
        assertThat(token.span().start()).isEqualTo(1);
        assertThat(doc.node(0, 0).tokenId().fileId()).isEqualTo(FILE);
    }

    @Test
    void placesChildrenBelowTheirContainer() throws Exception {
        LiveDocument doc = parse("""
                {
                  "Button": {"$class": "Component", "width": 10, "style": {"bold": true}},
                  "list": [1, 2]
                }
                """);

        LiveValue.ClassValue button = (LiveValue.ClassValue) doc.node(0, 0).value();
        assertThat(button.base()).isEqualTo(IdPack.single("Component"));
        assertThat(button.nodeStart()).isZero();
        assertThat(button.nodeCount()).isEqualTo(2);
        assertThat(doc.node(1, 1).value()).isEqualTo(new LiveValue.ObjectValue(0, 1));
        assertThat(doc.node(2, 0).idPack()).isEqualTo(IdPack.single("bold"));

        assertThat(doc.node(0, 1).value()).isEqualTo(new LiveValue.ArrayValue(2, 2));
        assertThat(doc.node(1, 2).idPack()).isEqualTo(IdPack.empty());
        assertThat(doc.node(1, 3).value()).isEqualTo(new LiveValue.IntValue(2));
    }

    @Test
    void multiSegmentIdsShiftTheChildLevel() throws Exception {
        LiveDocument doc = parse("""
                {"a::b": {"$class": "Component", "c": 1}}
                """);

        LiveNode node = doc.node(0, 0);
        assertThat(doc.segments(node.idPack())).containsExactly(LiveId.of("a"), LiveId.of("b"));
        assertThat(doc.levelLength(1)).isZero();
        assertThat(doc.node(2, 0).idPack()).isEqualTo(IdPack.single("c"));
    }

    @Test
    void parsesTaggedValues() throws Exception {
        LiveDocument doc = parse("""
                {
                  "ref": {"$id": "theme::primary"},
                  "tint": {"$color": "#ff0000"},
                  "shade": {"$color": "#00ff0080"},
                  "pos": {"$vec2": [1, 2.5]},
                  "dir": {"$vec3": [0, 1, 0]},
                  "icon": {"$resource": "icons::home"},
                  "draw": {"$fn": ["return", "1"]},
                  "speed": {"$var": ["2"]},
                  "make": {"$call": "Factory", "arg": 1}
                }
                """);

        assertThat(doc.format(((LiveValue.IdValue) doc.node(0, 0).value()).id())).isEqualTo("theme::primary");
        assertThat(doc.node(0, 1).value()).isEqualTo(new LiveValue.ColorValue(0xff0000ff));
        assertThat(doc.node(0, 2).value()).isEqualTo(new LiveValue.ColorValue(0x00ff0080));
        assertThat(doc.node(0, 3).value()).isEqualTo(new LiveValue.Vec2Value(1f, 2.5f));
        assertThat(doc.node(0, 4).value()).isEqualTo(new LiveValue.Vec3Value(0f, 1f, 0f));
        assertThat(doc.format(((LiveValue.ResourceRefValue) doc.node(0, 5).value()).target())).isEqualTo("icons::home");

        LiveValue.FnValue draw = (LiveValue.FnValue) doc.node(0, 6).value();
        assertThat(doc.tokens(draw.tokenStart(), draw.tokenCount())).extracting(TokenWithSpan::text)
                .containsExactly("return", "1");
        assertThat(draw.scopeCount()).isZero();
        assertThat(doc.node(0, 7).value()).isInstanceOf(LiveValue.VarDefValue.class);

        LiveValue.CallValue make = (LiveValue.CallValue) doc.node(0, 8).value();
        assertThat(make.target()).isEqualTo(IdPack.single("Factory"));
        assertThat(make.nodeCount()).isEqualTo(1);
    }

    @Test
    void parsesImportForms() throws Exception {
        LiveDocument doc = parse("""
                {
                  "$use": "crate::theme::*",
                  "$use": "widgets::button::Button",
                  "$use": "widgets::button::Styles::*"
                }
                """);

        LiveNode all = doc.node(0, 0);
        assertThat(all.idPack()).isEqualTo(IdPack.empty());
        assertThat(all.value()).isEqualTo(new LiveValue.UseValue(LiveId.of("crate"), LiveId.of("theme")));

        assertThat(doc.node(0, 1).idPack()).isEqualTo(IdPack.single("Button"));
        assertThat(doc.segments(doc.node(0, 2).idPack())).containsExactly(LiveId.of("Styles"), LiveId.EMPTY);
    }

    @Test
    void emptyObjectsAndClassesHaveEmptySpans() throws Exception {
        LiveDocument doc = parse("""
                {"o": {}, "K": {"$class": "Component"}}
                """);

        assertThat(doc.node(0, 0).value()).isEqualTo(new LiveValue.ObjectValue(0, 0));
        assertThat(doc.node(0, 1).value()).isEqualTo(new LiveValue.ClassValue(IdPack.single("Component"), 0, 0));
    }

    @Test
    void rejectsNull() {
        LiveParseException e = catchThrowableOfType(() -> parse("{\n  \"x\": null\n}"), LiveParseException.class);

        assertThat(e).isNotNull();
        assertThat(e.getError().file()).isEqualTo("test.json");
        assertThat(e.getError().line()).isEqualTo(2);
        assertThat(e.getError().message()).contains("null");
    }

    @Test
    void rejectsUnknownTags() {
        assertThatThrownBy(() -> parse("{\"x\": {\"$blob\": 1}}"))
                .isInstanceOf(LiveParseException.class)
                .hasMessageContaining("Unknown tag $blob");
    }

    @Test
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> parse("{\"x\": 1,")).isInstanceOf(LiveParseException.class);
        assertThatThrownBy(() -> parse("[1, 2]")).isInstanceOf(LiveParseException.class);
    }

    @Test
    void rejectsInvalidImportsAndColors() {
        assertThatThrownBy(() -> parse("{\"$use\": \"only::two\"}"))
                .isInstanceOf(LiveParseException.class)
                .hasMessageContaining("crate::module::item");
        assertThatThrownBy(() -> parse("{\"$use\": \"a::b::*::c\"}")).isInstanceOf(LiveParseException.class);
        assertThatThrownBy(() -> parse("{\"c\": {\"$color\": \"#12\"}}")).isInstanceOf(LiveParseException.class);
        assertThatThrownBy(() -> parse("{\"v\": {\"$vec2\": [1]}}")).isInstanceOf(LiveParseException.class);
    }
}
