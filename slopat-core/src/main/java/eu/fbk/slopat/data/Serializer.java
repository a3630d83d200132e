package eu.fbk.slopat.data;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.base.Throwables;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.io.CharStreams;

import org.openrdf.model.BNode;
import org.openrdf.model.Literal;
import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.rio.ParserConfig;
import org.openrdf.rio.RDFFormat;
import org.openrdf.rio.RDFHandlerException;
import org.openrdf.rio.RDFParseException;
import org.openrdf.rio.RDFParser;
import org.openrdf.rio.Rio;
import org.openrdf.rio.helpers.BasicParserSettings;
import org.openrdf.rio.helpers.StatementCollector;
import org.openrdf.rio.turtle.TurtleUtil;

import eu.fbk.slopat.vocabulary.SLOP;

/**
 * Textual, Turtle-like encoding of {@link StatementSet}s.
 * <p>
 * Method {@link #serialize(StatementSet)} emits one {@code @prefix} line per namespace of the
 * set, followed by one block per subject (in order of first appearance). A block starts with the
 * subject on its own line, followed by one indented {@code predicate object} line per statement:
 * all lines but the last one end with {@code " ;"}, the last one ends the block with
 * {@code " ."}. URIs are written in prefixed form when a namespace matches (the longest one is
 * chosen) and the remaining local part is a plain name (ASCII letters, digits, {@code _} and
 * {@code -}, not starting with a digit or dash), otherwise in {@code <uri>} form. Literals are
 * quoted and escaped as in Turtle; typed literals carry a {@code ^^datatype} suffix and
 * language-tagged literals an {@code @lang} suffix.
 * </p>
 * <p>
 * Method {@link #parse(String)} reads Turtle through the Sesame Rio parser, so that both the
 * output of the writer and hand-written ontology files are accepted. Relative IRIs are resolved
 * against the ontology namespace and blank node labels are preserved. Parsing the output of
 * {@code serialize} yields the same multiset of statements.
 * </p>
 * <p>
 * Instances are stateless and thread-safe.
 * </p>
 */
public final class Serializer {

    private static final String INDENT = "    ";

    private static final String BASE = SLOP.NAMESPACE;

    /**
     * Serializes a statement set using its own namespace table.
     *
     * @param statementSet
     *            the statement set
     * @return the produced text
     */
    public String serialize(final StatementSet statementSet) {
        return serialize(statementSet.getStatements(), statementSet.getNamespaces());
    }

    /**
     * Serializes the supplied statements using the namespace table specified.
     *
     * @param statements
     *            the statements to serialize
     * @param namespaces
     *            the prefix-to-namespace map
     * @return the produced text
     */
    public String serialize(final Iterable<? extends Statement> statements,
            final Map<String, String> namespaces) {
        final StringBuilder builder = new StringBuilder();
        try {
            write(statements, namespaces, builder);
        } catch (final IOException ex) {
            throw Throwables.propagate(ex); // cannot happen with a StringBuilder
        }
        return builder.toString();
    }

    /**
     * Writes the supplied statements to an {@code Appendable} sink.
     *
     * @param statements
     *            the statements to serialize
     * @param namespaces
     *            the prefix-to-namespace map
     * @param out
     *            the sink
     * @throws IOException
     *             on failure writing to the sink
     */
    public void write(final Iterable<? extends Statement> statements,
            final Map<String, String> namespaces, final Appendable out) throws IOException {

        Preconditions.checkNotNull(namespaces);

        for (final Map.Entry<String, String> entry : namespaces.entrySet()) {
            out.append("@prefix ").append(entry.getKey()).append(": <")
                    .append(TurtleUtil.encodeURIString(entry.getValue())).append("> .\n");
        }
        if (!namespaces.isEmpty()) {
            out.append('\n');
        }

        final Map<Resource, List<Statement>> blocks = Maps.newLinkedHashMap();
        for (final Statement statement : statements) {
            List<Statement> block = blocks.get(statement.getSubject());
            if (block == null) {
                block = Lists.newArrayList();
                blocks.put(statement.getSubject(), block);
            }
            block.add(statement);
        }

        for (final Map.Entry<Resource, List<Statement>> entry : blocks.entrySet()) {
            writeValue(entry.getKey(), namespaces, out);
            out.append('\n');
            final List<Statement> block = entry.getValue();
            for (int i = 0; i < block.size(); ++i) {
                final Statement statement = block.get(i);
                out.append(INDENT);
                writeValue(statement.getPredicate(), namespaces, out);
                out.append(' ');
                writeValue(statement.getObject(), namespaces, out);
                out.append(i < block.size() - 1 ? " ;\n" : " .\n");
            }
            out.append('\n');
        }
    }

    /**
     * Parses a statement set out of the supplied text. The namespaces of the returned set are the
     * ones declared in the text, in declaration order.
     *
     * @param text
     *            the text to parse
     * @return the parsed statement set
     * @throws ParseException
     *             on syntax errors
     */
    public StatementSet parse(final String text) throws ParseException {
        Preconditions.checkNotNull(text);
        final List<Statement> statements = Lists.newArrayList();
        final Map<String, String> namespaces = Maps.newLinkedHashMap();
        final RDFParser parser = Rio.createParser(RDFFormat.TURTLE);
        parser.setValueFactory(Data.getValueFactory());
        final ParserConfig config = parser.getParserConfig();
        config.set(BasicParserSettings.VERIFY_DATATYPE_VALUES, false);
        config.set(BasicParserSettings.NORMALIZE_DATATYPE_VALUES, false);
        config.set(BasicParserSettings.PRESERVE_BNODE_IDS, true);
        parser.setRDFHandler(new StatementCollector(statements, namespaces));
        try {
            parser.parse(new StringReader(text), BASE);
        } catch (final RDFParseException ex) {
            final int line = ex.getLineNumber();
            throw new ParseException(lineAt(text, line), line < 0 ? ex.getMessage()
                    : ex.getMessage() + " at line " + line, ex);
        } catch (final RDFHandlerException ex) {
            throw new ParseException(text, ex.getMessage(), ex);
        } catch (final IOException ex) {
            throw Throwables.propagate(ex); // cannot happen with a StringReader
        }
        return new StatementSet(statements, namespaces);
    }

    /**
     * Parses a statement set out of the text read from the supplied reader.
     *
     * @param reader
     *            the reader, not closed by this method
     * @return the parsed statement set
     * @throws IOException
     *             on failure reading text
     * @throws ParseException
     *             on syntax errors
     */
    public StatementSet parse(final Reader reader) throws IOException, ParseException {
        return parse(CharStreams.toString(reader));
    }

    private static void writeValue(final Value value, final Map<String, String> namespaces,
            final Appendable out) throws IOException {

        if (value instanceof URI) {
            final String string = value.stringValue();
            final String prefix = Data.prefixFor(string, namespaces);
            if (prefix != null) {
                final String localName = string.substring(namespaces.get(prefix).length());
                if (isLocalName(localName)) {
                    out.append(prefix).append(':').append(localName);
                    return;
                }
            }
            out.append('<').append(TurtleUtil.encodeURIString(string)).append('>');

        } else if (value instanceof BNode) {
            out.append("_:").append(((BNode) value).getID());

        } else {
            final Literal literal = (Literal) value;
            out.append('"').append(TurtleUtil.encodeString(literal.getLabel())).append('"');
            if (literal.getLanguage() != null) {
                out.append('@').append(literal.getLanguage());
            } else if (literal.getDatatype() != null) {
                out.append("^^");
                writeValue(literal.getDatatype(), namespaces, out);
            }
        }
    }

    private static boolean isLocalName(final String string) {
        if (string.isEmpty() || !isNameStartChar(string.charAt(0))) {
            return false;
        }
        for (int i = 1; i < string.length(); ++i) {
            final char c = string.charAt(i);
            if (!isNameStartChar(c) && c != '-' && (c < '0' || c > '9')) {
                return false;
            }
        }
        return true;
    }

    private static boolean isNameStartChar(final char c) {
        return c >= 'a' && c <= 'z' || c >= 'A' && c <= 'Z' || c == '_';
    }

    private static String lineAt(final String text, final int lineNumber) {
        final List<String> lines = Splitter.on('\n').splitToList(text);
        return lineNumber >= 1 && lineNumber <= lines.size() ? lines.get(lineNumber - 1) : text;
    }

}
