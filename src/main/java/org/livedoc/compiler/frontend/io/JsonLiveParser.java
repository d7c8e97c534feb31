package org.livedoc.compiler.frontend.io;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.livedoc.compiler.diagnostics.LiveFileError;
import org.livedoc.compiler.diagnostics.LiveParseException;
import org.livedoc.compiler.document.LiveDocument;
import org.livedoc.compiler.document.LiveNode;
import org.livedoc.compiler.document.LiveValue;
import org.livedoc.compiler.model.FileId;
import org.livedoc.compiler.model.IdPack;
import org.livedoc.compiler.model.LiveId;
import org.livedoc.compiler.model.Span;
import org.livedoc.compiler.model.TokenId;
import org.livedoc.compiler.model.TokenWithSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the JSON form of a node tree into a raw document.
 *
 * <p>A document is a JSON object whose members are the top-level declarations, keyed by
 * their id ({@code a}, {@code a::b}, or {@code ""} for an anonymous entry). Values map to
 * node values as follows:</p>
 * <ul>
 *   <li>booleans, integers, fractions and strings to the matching primitive,</li>
 *   <li>arrays to an array of anonymous elements,</li>
 *   <li>objects to an object, unless the first member is one of the tags
 *       {@code $class}, {@code $call} (base or target id, the remaining members are the
 *       fields), {@code $id}, {@code $resource} (an id), {@code $color}
 *       ({@code #rrggbb} or {@code #rrggbbaa}), {@code $vec2}, {@code $vec3} (number arrays)
 *       or {@code $fn}, {@code $var} (an array of body tokens).</li>
 * </ul>
 * A member {@code "$use": "crate::module::item"} declares an import. The item may be
 * {@code *}, a name, a path, or a path ending in {@code *}.
 *
 * <p>Every node records one token whose span is the character offset of its key, so
 * diagnostics point back into the JSON text.</p>
 */
public final class JsonLiveParser implements ILiveParser {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLiveParser.class);

    private static final String USE = "$use";
    private static final String PATH_SEPARATOR = "::";
    private static final String WILDCARD = "*";

    private final JsonFactory factory;

    public JsonLiveParser() {
        this(new ObjectMapper());
    }

    public JsonLiveParser(ObjectMapper mapper) {
        this.factory = mapper.getFactory();
    }

    @Override
    public LiveDocument parse(FileId fileId, String file, String source) throws LiveParseException {
        LiveDocument document = new LiveDocument();
        try (JsonParser parser = factory.createParser(source)) {
            new Reader(fileId, file, source, parser, document).readDocument();
        } catch (JsonProcessingException e) {
            throw new LiveParseException(LiveFileError.of(file, source, spanOf(fileId, e.getLocation()),
                    e.getOriginalMessage()), e);
        } catch (IOException e) {
            throw new LiveParseException(LiveFileError.of(file, source, null, e.getMessage()), e);
        }
        LOG.debug("Parsed {}: {} top-level declarations, {} tokens", file, document.levelLength(0), document.tokenCount());
        return document;
    }

    private static Span spanOf(FileId fileId, JsonLocation location) {
        if (location == null || location.getCharOffset() < 0) {
            return null;
        }
        int offset = (int) location.getCharOffset();
        return new Span(fileId, offset, offset);
    }

    /**
     * The state of a single parse.
     */
    private static final class Reader {

        private final FileId fileId;
        private final String file;
        private final String source;
        private final JsonParser parser;
        private final LiveDocument doc;

        Reader(FileId fileId, String file, String source, JsonParser parser, LiveDocument doc) {
            this.fileId = fileId;
            this.file = file;
            this.source = source;
            this.parser = parser;
            this.doc = doc;
        }

        void readDocument() throws IOException, LiveParseException {
            if (parser.nextToken() != JsonToken.START_OBJECT) {
                throw fail("Expected a JSON object");
            }
            parser.nextToken();
            readMembers(0);
            if (parser.nextToken() != null) {
                throw fail("Unexpected content after the document");
            }
        }

        /**
         * Reads declarations starting at the current token up to the closing brace.
         *
         * @return The number of nodes added to {@code level}.
         */
        private int readMembers(int level) throws IOException, LiveParseException {
            int count = 0;
            while (parser.currentToken() == JsonToken.FIELD_NAME) {
                String key = parser.getCurrentName();
                TokenId token = pushToken(key);
                parser.nextToken();
                if (USE.equals(key)) {
                    doc.pushNode(level, readUse(token));
                } else {
                    IdPack id = pathId(key);
                    LiveValue value = readValue(level + id.segmentCount());
                    doc.pushNode(level, new LiveNode(token, id, value));
                }
                count++;
                parser.nextToken();
            }
            return count;
        }

        private LiveValue readValue(int childLevel) throws IOException, LiveParseException {
            JsonToken current = parser.currentToken();
            if (current == null) {
                throw fail("Unexpected end of input");
            }
            switch (current) {
                case VALUE_TRUE:
                    return new LiveValue.BoolValue(true);
                case VALUE_FALSE:
                    return new LiveValue.BoolValue(false);
                case VALUE_NUMBER_INT:
                    return new LiveValue.IntValue(parser.getLongValue());
                case VALUE_NUMBER_FLOAT:
                    return new LiveValue.FloatValue(parser.getDoubleValue());
                case VALUE_STRING: {
                    String text = parser.getText();
                    return new LiveValue.StringValue(doc.appendString(text), text.length());
                }
                case START_ARRAY:
                    return readArray(childLevel);
                case START_OBJECT:
                    return readObject(childLevel);
                case VALUE_NULL:
                    throw fail("null is not a value");
                default:
                    throw fail("Unexpected " + current);
            }
        }

        private LiveValue readArray(int childLevel) throws IOException, LiveParseException {
            int start = doc.levelLength(childLevel);
            int count = 0;
            while (parser.nextToken() != JsonToken.END_ARRAY) {
                TokenId token = pushToken("[" + count + "]");
                LiveValue value = readValue(childLevel + IdPack.empty().segmentCount());
                doc.pushNode(childLevel, new LiveNode(token, IdPack.empty(), value));
                count++;
            }
            return new LiveValue.ArrayValue(start, count);
        }

        private LiveValue readObject(int childLevel) throws IOException, LiveParseException {
            JsonToken first = parser.nextToken();
            if (first == JsonToken.END_OBJECT) {
                return new LiveValue.ObjectValue(doc.levelLength(childLevel), 0);
            }
            String key = parser.getCurrentName();
            if (key == null || !key.startsWith("$") || USE.equals(key)) {
                int start = doc.levelLength(childLevel);
                return new LiveValue.ObjectValue(start, readMembers(childLevel));
            }
            parser.nextToken();
            switch (key) {
                case "$class": {
                    IdPack base = pathId(readString(key));
                    parser.nextToken();
                    int start = doc.levelLength(childLevel);
                    return new LiveValue.ClassValue(base, start, readMembers(childLevel));
                }
                case "$call": {
                    IdPack target = pathId(readString(key));
                    parser.nextToken();
                    int start = doc.levelLength(childLevel);
                    return new LiveValue.CallValue(target, start, readMembers(childLevel));
                }
                case "$id":
                    return closeTag(new LiveValue.IdValue(pathId(readString(key))));
                case "$resource":
                    return closeTag(new LiveValue.ResourceRefValue(pathId(readString(key))));
                case "$color":
                    return closeTag(new LiveValue.ColorValue(parseColor(readString(key))));
                case "$vec2": {
                    float[] v = readNumbers(key, 2);
                    return closeTag(new LiveValue.Vec2Value(v[0], v[1]));
                }
                case "$vec3": {
                    float[] v = readNumbers(key, 3);
                    return closeTag(new LiveValue.Vec3Value(v[0], v[1], v[2]));
                }
                case "$fn": {
                    int tokenStart = doc.tokenCount();
                    int tokenCount = readBodyTokens(key);
                    return closeTag(new LiveValue.FnValue(tokenStart, tokenCount, doc.scopeCount(), 0));
                }
                case "$var": {
                    int tokenStart = doc.tokenCount();
                    int tokenCount = readBodyTokens(key);
                    return closeTag(new LiveValue.VarDefValue(tokenStart, tokenCount, doc.scopeCount(), 0));
                }
                default:
                    throw fail("Unknown tag " + key);
            }
        }

        private LiveNode readUse(TokenId token) throws IOException, LiveParseException {
            String path = readString(USE);
            String[] parts = path.split(PATH_SEPARATOR, -1);
            if (parts.length < 3 || parts[0].isEmpty() || parts[1].isEmpty()) {
                throw fail("Import must have the form crate::module::item, got " + path);
            }
            List<LiveId> item = new ArrayList<>();
            for (int i = 2; i < parts.length; i++) {
                boolean last = i == parts.length - 1;
                if (WILDCARD.equals(parts[i]) && last) {
                    item.add(LiveId.EMPTY);
                } else if (parts[i].isEmpty() || WILDCARD.equals(parts[i])) {
                    throw fail("Invalid import path " + path);
                } else {
                    item.add(LiveId.of(parts[i]));
                }
            }
            IdPack id = item.size() == 1 && item.get(0).isEmpty() ? IdPack.empty() : doc.pushMultiId(item);
            return new LiveNode(token, id, new LiveValue.UseValue(LiveId.of(parts[0]), LiveId.of(parts[1])));
        }

        private String readString(String tag) throws IOException, LiveParseException {
            if (parser.currentToken() != JsonToken.VALUE_STRING) {
                throw fail(tag + " expects a string");
            }
            return parser.getText();
        }

        private float[] readNumbers(String tag, int expected) throws IOException, LiveParseException {
            if (parser.currentToken() != JsonToken.START_ARRAY) {
                throw fail(tag + " expects an array of " + expected + " numbers");
            }
            float[] values = new float[expected];
            int count = 0;
            while (parser.nextToken() != JsonToken.END_ARRAY) {
                if (!parser.currentToken().isNumeric() || count == expected) {
                    throw fail(tag + " expects an array of " + expected + " numbers");
                }
                values[count++] = parser.getFloatValue();
            }
            if (count != expected) {
                throw fail(tag + " expects an array of " + expected + " numbers");
            }
            return values;
        }

        private int readBodyTokens(String tag) throws IOException, LiveParseException {
            if (parser.currentToken() != JsonToken.START_ARRAY) {
                throw fail(tag + " expects an array of tokens");
            }
            int count = 0;
            while (parser.nextToken() != JsonToken.END_ARRAY) {
                if (parser.currentToken() != JsonToken.VALUE_STRING) {
                    throw fail(tag + " expects an array of tokens");
                }
                pushToken(parser.getText());
                count++;
            }
            return count;
        }

        private LiveValue closeTag(LiveValue value) throws IOException, LiveParseException {
            if (parser.nextToken() != JsonToken.END_OBJECT) {
                throw fail("Unexpected member after a tag");
            }
            return value;
        }

        private int parseColor(String text) throws LiveParseException {
            if (!text.startsWith("#") || (text.length() != 7 && text.length() != 9)) {
                throw fail("Invalid color " + text);
            }
            String hex = text.length() == 7 ? text.substring(1) + "ff" : text.substring(1);
            try {
                return Integer.parseUnsignedInt(hex, 16);
            } catch (NumberFormatException e) {
                throw new LiveParseException(LiveFileError.of(file, source, currentSpan(0), "Invalid color " + text), e);
            }
        }

        private IdPack pathId(String text) {
            if (text.isEmpty()) {
                return IdPack.empty();
            }
            List<LiveId> segments = new ArrayList<>();
            for (String part : text.split(PATH_SEPARATOR, -1)) {
                segments.add(LiveId.of(part));
            }
            return doc.pushMultiId(segments);
        }

        private TokenId pushToken(String text) {
            return new TokenId(fileId, doc.pushToken(new TokenWithSpan(text, currentSpan(text.length()))));
        }

        private Span currentSpan(int length) {
            long offset = parser.getTokenLocation().getCharOffset();
            int start = (int) Math.max(0, offset);
            return new Span(fileId, start, start + length);
        }

        private LiveParseException fail(String message) {
            return new LiveParseException(LiveFileError.of(file, source, currentSpan(0), message));
        }
    }
}
