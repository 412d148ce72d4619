package ai.treescan.grammar;

import ai.treescan.util.TextCanonicalizer;
import java.util.ArrayDeque;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;

/**
 * {@link Grammar} backed by a native Tree-sitter parser. The native tree is copied into a {@link SyntaxTree} right
 * away, so nothing outside this class ever holds a {@link TSNode}.
 *
 * <p>Subclasses only provide the language id, extensions and the Tree-sitter language object.
 */
public abstract class TreeSitterGrammar implements Grammar {
    private static final Logger logger = LogManager.getLogger(TreeSitterGrammar.class);
    // Native library loading is assumed automatic by the io.github.bonede.tree_sitter library.

    // TSParser is not thread-safe; each scan worker gets its own.
    private final ThreadLocal<TSLanguage> threadLocalLanguage = ThreadLocal.withInitial(this::createTSLanguage);
    private final ThreadLocal<TSParser> threadLocalParser = ThreadLocal.withInitial(() -> {
        var parser = new TSParser();
        if (!configureParser(parser, threadLocalLanguage.get())) {
            var languageName = threadLocalLanguage.get().getClass().getSimpleName();
            logger.error("Failed to set language on TSParser for {}", languageName);
            throw new IllegalStateException(
                    "Tree-sitter language " + languageName + " is incompatible with the parser runtime");
        }
        return parser;
    });

    /** UTF-8 length of a byte order mark. */
    private static final int BOM_BYTES = 3;

    protected abstract TSLanguage createTSLanguage();

    /**
     * Prepares a fresh per-thread parser. Returns false if the language was rejected, typically because it was
     * generated for another Tree-sitter ABI version.
     */
    protected boolean configureParser(TSParser parser, TSLanguage language) {
        return parser.setLanguage(language);
    }

    /**
     * {@inheritDoc}
     *
     * <p>A leading byte order mark is hidden from the native parser, but the tree keeps the original text and all
     * offsets count the mark, so spans slice the caller's text and the file bytes alike.
     *
     * @throws IllegalStateException if the grammar's language cannot be loaded into a parser
     */
    @Override
    public SyntaxTree parse(String file, String source) throws ParseException {
        String text = TextCanonicalizer.stripUtf8Bom(source);
        int shift = text.length() == source.length() ? 0 : BOM_BYTES;
        TSParser parser = threadLocalParser.get();
        TSTree tree;
        try {
            tree = parser.parseString(null, text);
        } catch (RuntimeException e) {
            throw new ParseException("Tree-sitter parser failed", e, file);
        }
        if (tree == null) {
            throw new ParseException("Parser produced no tree", file, null);
        }
        TSNode rootNode = tree.getRootNode();
        if (rootNode == null || rootNode.isNull()) {
            throw new ParseException("Parser produced a null root node", file, null);
        }

        var builder = SyntaxTree.builder(languageId(), file, source);
        copyTree(rootNode, builder, shift);
        var syntaxTree = builder.build();
        if (isUnrecoverable(syntaxTree)) {
            throw new ParseException(
                    "Nothing could be recovered from the source",
                    file,
                    syntaxTree.errorSpan().orElse(syntaxTree.root().span()));
        }
        if (syntaxTree.hasErrors()) {
            logger.debug("Recovered from syntax errors in {}; furthest at {}", file, syntaxTree.errorSpan().orElse(null));
        }
        return syntaxTree;
    }

    /** The root is an error node itself, or every named node below the root is one. */
    static boolean isUnrecoverable(SyntaxTree tree) {
        var root = tree.root();
        if (root.isError()) {
            return true;
        }
        if (!root.hasError()) {
            return false;
        }
        var named = root.namedChildren();
        return !named.isEmpty() && named.stream().allMatch(Node::isError);
    }

    private static final class Cursor {
        final TSNode node;
        final int count;
        int next;

        Cursor(TSNode node) {
            this.node = node;
            this.count = node.getChildCount();
        }
    }

    /** Iterative copy; long left-recursive expressions make native trees deeper than the Java stack likes. */
    private static void copyTree(TSNode rootNode, SyntaxTree.Builder builder, int shift) {
        var stack = new ArrayDeque<Cursor>();
        open(builder, rootNode, null, shift);
        stack.push(new Cursor(rootNode));
        while (!stack.isEmpty()) {
            var top = stack.peek();
            if (top.next < top.count) {
                int i = top.next++;
                TSNode child = top.node.getChild(i);
                if (child == null || child.isNull()) {
                    continue;
                }
                open(builder, child, top.node.getFieldNameForChild(i), shift);
                stack.push(new Cursor(child));
            } else {
                builder.close();
                stack.pop();
            }
        }
    }

    /** Copies one node, moving offsets right by {@code shift} bytes; columns move only on the first row. */
    private static void open(SyntaxTree.Builder builder, TSNode node, @Nullable String fieldName, int shift) {
        var start = node.getStartPoint();
        var end = node.getEndPoint();
        builder.open(
                node.getType(),
                node.isNamed(),
                fieldName,
                node.getStartByte() + shift,
                node.getEndByte() + shift,
                new Point(start.getRow(), start.getColumn() + (start.getRow() == 0 ? shift : 0)),
                new Point(end.getRow(), end.getColumn() + (end.getRow() == 0 ? shift : 0)),
                node.isMissing());
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + languageId() + "]";
    }
}
