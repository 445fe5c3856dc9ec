package org.formcov.reader;

import org.formcov.FormReadException;
import org.formcov.ast.Form;
import org.formcov.ast.meta.Metadata;
import org.formcov.ast.meta.MetadataTable;

import java.io.Closeable;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads top-level forms from a {@link SourceProvider}, one at a time.
 * <p>
 * Every metadata-capable form gets its starting line, column and source name recorded in the supplied
 * {@link MetadataTable}. A {@code ^meta form} prefix layers explicit attributes over the recorded ones: a map
 * contributes its keyword entries, a keyword {@code ^:k} sets {@code k} to {@code true}, and a symbol or string
 * becomes the {@code tag}. The reader never looks further ahead than the character after the current form, so
 * forms can be read, instrumented and evaluated in turn.
 */
public class FormReader implements Closeable {

    private static final int BUFFER_SIZE = 4096;
    private static final int NONE = -2;
    private static final String TAG = "tag";

    private final SourceProvider provider;
    private final MetadataTable metadata;
    private final char[] buffer = new char[BUFFER_SIZE];
    private int bufferLength = 0;
    private int bufferPosition = 0;
    private int current = NONE;
    private int line = 1;
    private int column = 1;

    public FormReader(SourceProvider provider, MetadataTable metadata) {
        this.provider = provider;
        this.metadata = metadata;
    }

    /**
     * Reads every form from a string. Convenience for tests and small snippets.
     */
    public static List<Form> readAll(String text, MetadataTable metadata) {
        List<Form> forms = new ArrayList<>();
        try (FormReader reader = new FormReader(new StringSourceProvider(text), metadata)) {
            Optional<Form> form;
            while ((form = reader.read()).isPresent()) {
                forms.add(form.get());
            }
        }
        return forms;
    }

    /**
     * Reads a single form from a string, ignoring anything after it.
     */
    public static Form readOne(String text, MetadataTable metadata) {
        try (FormReader reader = new FormReader(new StringSourceProvider(text), metadata)) {
            return reader.read().orElseThrow(() -> new FormReadException("No form in input", "<string>", 1, 1));
        }
    }

    /**
     * Reads the next top-level form.
     *
     * @return the form, or empty at end of input
     * @throws FormReadException if the text is malformed or the source cannot be read
     */
    public Optional<Form> read() {
        try {
            while (true) {
                skipWhitespaceAndComments();
                if (peek() == -1) {
                    return Optional.empty();
                }
                if (peek() == ')' || peek() == ']' || peek() == '}') {
                    throw error("Unmatched delimiter '" + (char) peek() + "'");
                }
                Form form = readForm();
                if (form != null) {
                    return Optional.of(form);
                }
            }
        } catch (IOException e) {
            throw new FormReadException("Unable to read source: " + e.getMessage(), provider.sourceName(), line, column, e);
        }
    }

    public int getLine() {
        return line;
    }

    @Override
    public void close() {
        try {
            provider.close();
        } catch (IOException e) {
            throw new FormReadException("Unable to close source: " + e.getMessage(), provider.sourceName(), line, column, e);
        }
    }

    // Returns null for a discarded form (#_).
    private Form readForm() throws IOException {
        skipWhitespaceAndComments();
        int startLine = line;
        int startColumn = column;
        int c = peek();
        if (c == -1) {
            throw error("Unexpected end of input");
        }
        if (c == '^') {
            return readWithMetadata();
        }
        Form form = switch (c) {
            case '(' -> Form.list(readDelimited(')'));
            case '[' -> Form.vector(readDelimited(']'));
            case '{' -> readMap();
            case '"' -> readString();
            case '\\' -> readChar();
            case ':' -> readKeyword();
            case '\'' -> readWrapped("quote");
            case '#' -> readDispatch();
            default -> readToken();
        };
        if (form == null) {
            return null;
        }
        return metadata.put(form, Metadata.ofLine(startLine)
                .with(Metadata.COLUMN, startColumn)
                .with(Metadata.SOURCE, provider.sourceName()));
    }

    private List<Form> readDelimited(char close) throws IOException {
        consume();
        List<Form> elements = new ArrayList<>();
        while (true) {
            skipWhitespaceAndComments();
            int c = peek();
            if (c == -1) {
                throw error("Unexpected end of input, expected '" + close + "'");
            }
            if (c == close) {
                consume();
                return elements;
            }
            if (c == ')' || c == ']' || c == '}') {
                throw error("Mismatched delimiter '" + (char) c + "', expected '" + close + "'");
            }
            Form element = readForm();
            if (element != null) {
                elements.add(element);
            }
        }
    }

    private Form readMap() throws IOException {
        List<Form> elements = readDelimited('}');
        if (elements.size() % 2 != 0) {
            throw error("Map literal must contain an even number of forms");
        }
        return Form.map(elements.toArray(new Form[0]));
    }

    private Form readWrapped(String symbolName) throws IOException {
        int startLine = line;
        int startColumn = column;
        consume();
        Form target = readForm();
        if (target == null) {
            throw error("Nothing to " + symbolName + " after discard");
        }
        Form.Symbol symbol = metadata.put(Form.symbol(symbolName), Metadata.ofLine(startLine)
                .with(Metadata.COLUMN, startColumn)
                .with(Metadata.SOURCE, provider.sourceName()));
        return Form.list(symbol, target);
    }

    private Form readWithMetadata() throws IOException {
        consume();
        Form meta = readForm();
        if (meta == null) {
            throw error("Missing metadata after '^'");
        }
        Metadata explicit = explicitMetadata(meta);
        Form target = readForm();
        if (target == null) {
            throw error("Nothing to attach metadata to");
        }
        if (!target.isMetadataCapable()) {
            throw error("Metadata can only be applied to symbols and collections");
        }
        return metadata.vary(target, m -> m.merge(explicit));
    }

    private Metadata explicitMetadata(Form meta) {
        if (meta instanceof Form.Keyword keyword) {
            return Metadata.of(keyword.name(), Boolean.TRUE);
        }
        if (meta instanceof Form.Symbol symbol) {
            return Metadata.of(TAG, symbol.fullName());
        }
        if (meta instanceof Form.Str str) {
            return Metadata.of(TAG, str.value());
        }
        if (!(meta instanceof Form.MapForm map)) {
            throw error("Metadata must be a symbol, keyword, string or map");
        }
        Metadata explicit = Metadata.EMPTY;
        for (Form.MapForm.Entry entry : map.entries()) {
            if (!(entry.key() instanceof Form.Keyword key)) {
                throw error("Metadata keys must be keywords");
            }
            explicit = explicit.with(key.name(), attributeValue(entry.value()));
        }
        return explicit;
    }

    // line and column are stored as Integer, as the reader records them
    private static Object attributeValue(Form value) {
        if (value instanceof Form.Num num && num.value() instanceof Long n
            && n >= Integer.MIN_VALUE && n <= Integer.MAX_VALUE) {
            return n.intValue();
        }
        if (value instanceof Form.Str str) {
            return str.value();
        }
        if (value instanceof Form.Bool bool) {
            return bool.value();
        }
        return value;
    }

    private Form readDispatch() throws IOException {
        consume();
        int c = peek();
        switch (c) {
            case '{':
                return new Form.SetForm(readDelimited('}'));
            case '_':
                consume();
                readForm();
                return null;
            case '\'':
                return readWrapped("var");
            default:
                throw error("Unsupported dispatch macro '#" + (c == -1 ? "" : String.valueOf((char) c)) + "'");
        }
    }

    private Form readString() throws IOException {
        consume();
        StringBuilder sb = new StringBuilder();
        while (true) {
            int c = consume();
            if (c == -1) {
                throw error("Unexpected end of input inside string literal");
            }
            if (c == '"') {
                return Form.string(sb.toString());
            }
            if (c == '\\') {
                int escaped = consume();
                switch (escaped) {
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    default -> throw error("Invalid escape sequence '\\" + (escaped == -1 ? "" : String.valueOf((char) escaped)) + "'");
                }
            } else {
                sb.append((char) c);
            }
        }
    }

    private Form readChar() throws IOException {
        consume();
        int first = consume();
        if (first == -1) {
            throw error("Unexpected end of input in character literal");
        }
        StringBuilder sb = new StringBuilder().append((char) first);
        while (!isTerminator(peek())) {
            sb.append((char) consume());
        }
        String name = sb.toString();
        if (name.length() == 1) {
            return new Form.Char(name.charAt(0));
        }
        return switch (name) {
            case "newline" -> new Form.Char('\n');
            case "space" -> new Form.Char(' ');
            case "tab" -> new Form.Char('\t');
            case "return" -> new Form.Char('\r');
            default -> throw error("Unsupported character literal '\\" + name + "'");
        };
    }

    private Form readKeyword() throws IOException {
        consume();
        String name = readTokenText();
        if (name.isEmpty()) {
            throw error("Keyword name must not be empty");
        }
        return Form.keyword(name);
    }

    private Form readToken() throws IOException {
        String token = readTokenText();
        if (token.isEmpty()) {
            throw error("Unexpected character '" + (char) peek() + "'");
        }
        switch (token) {
            case "nil":
                return Form.nil();
            case "true":
                return Form.bool(true);
            case "false":
                return Form.bool(false);
            default:
                break;
        }
        if (looksNumeric(token)) {
            return readNumber(token);
        }
        return Form.symbol(token);
    }

    private Form.Num readNumber(String token) {
        try {
            if (token.endsWith("N")) {
                return new Form.Num(new BigInteger(token.substring(0, token.length() - 1)));
            }
            if (token.endsWith("M")) {
                return new Form.Num(new BigDecimal(token.substring(0, token.length() - 1)));
            }
            if (token.indexOf('.') >= 0 || token.indexOf('e') >= 0 || token.indexOf('E') >= 0) {
                return new Form.Num(Double.parseDouble(token));
            }
            BigInteger value = new BigInteger(token);
            return value.bitLength() < 64 ? new Form.Num(value.longValue()) : new Form.Num(value);
        } catch (NumberFormatException e) {
            throw error("Invalid number '" + token + "'");
        }
    }

    private static boolean looksNumeric(String token) {
        char first = token.charAt(0);
        if (Character.isDigit(first)) {
            return true;
        }
        return (first == '+' || first == '-') && token.length() > 1 && Character.isDigit(token.charAt(1));
    }

    private String readTokenText() throws IOException {
        StringBuilder sb = new StringBuilder();
        while (!isTerminator(peek())) {
            sb.append((char) consume());
        }
        return sb.toString();
    }

    private static boolean isTerminator(int c) {
        return c == -1 || Character.isWhitespace(c) || c == ',' || c == '(' || c == ')' || c == '['
               || c == ']' || c == '{' || c == '}' || c == '"' || c == ';';
    }

    private void skipWhitespaceAndComments() throws IOException {
        while (true) {
            int c = peek();
            if (c == -1) {
                return;
            }
            if (Character.isWhitespace(c) || c == ',') {
                consume();
            } else if (c == ';') {
                while (peek() != '\n' && peek() != -1) {
                    consume();
                }
            } else {
                return;
            }
        }
    }

    private int peek() throws IOException {
        if (current == NONE) {
            current = next();
        }
        return current;
    }

    private int consume() throws IOException {
        int c = peek();
        if (c != -1) {
            current = NONE;
            if (c == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        return c;
    }

    private int next() throws IOException {
        if (bufferPosition >= bufferLength) {
            bufferLength = provider.read(buffer, 0, buffer.length);
            bufferPosition = 0;
            if (bufferLength <= 0) {
                bufferLength = 0;
                return -1;
            }
        }
        return buffer[bufferPosition++];
    }

    private FormReadException error(String message) {
        return new FormReadException(message, provider.sourceName(), line, column);
    }
}
