package ai.docsite.markdown.parser;

import ai.docsite.markdown.MarkdownException;
import ai.docsite.markdown.ast.AstBuilder;
import ai.docsite.markdown.ast.AstTraversal;
import ai.docsite.markdown.ast.AstValidator;
import ai.docsite.markdown.ast.Node;
import ai.docsite.markdown.ast.NodeType;
import ai.docsite.markdown.ast.TableOfContentsGenerator;
import ai.docsite.markdown.ast.TocEntry;
import ai.docsite.markdown.block.BlockScanner;
import ai.docsite.markdown.block.BlockToken;
import ai.docsite.markdown.block.DefaultBlockScanner;
import ai.docsite.markdown.inline.DefaultInlineScanner;
import ai.docsite.markdown.inline.InlineScanner;
import ai.docsite.markdown.inline.InlineToken;
import ai.docsite.markdown.json.AstJsonWriter;
import ai.docsite.markdown.plugin.AstPlugin;
import ai.docsite.markdown.plugin.PluginRegistry;
import ai.docsite.markdown.render.HtmlRenderer;
import ai.docsite.markdown.render.NodeRenderer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point tying scanners, builder, plugins and renderers together.
 *
 * <p>No state survives a parse apart from the optional cache. Plugins must be registered before the
 * instance is shared between threads.
 */
public class MarkdownParser {

    private static final Logger LOGGER = LoggerFactory.getLogger(MarkdownParser.class);

    private final ParserOptions options;
    private final BlockScanner blockScanner;
    private final InlineScanner inlineScanner;
    private final AstBuilder astBuilder;
    private final PluginRegistry plugins;
    private final ParseCache cache;
    private final AstJsonWriter jsonWriter;

    public MarkdownParser() {
        this(ParserOptions.defaults());
    }

    public MarkdownParser(ParserOptions options) {
        this(options, new PluginRegistry(), new ParseCache());
    }

    MarkdownParser(ParserOptions options, PluginRegistry plugins, ParseCache cache) {
        this.options = Objects.requireNonNull(options, "options");
        this.plugins = Objects.requireNonNull(plugins, "plugins");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.blockScanner = new DefaultBlockScanner();
        this.inlineScanner = new DefaultInlineScanner(options.strikethrough());
        this.astBuilder = new AstBuilder(blockScanner, inlineScanner);
        this.jsonWriter = new AstJsonWriter();
    }

    public ParserOptions options() {
        return options;
    }

    public List<BlockToken> tokenize(String text) {
        return blockScanner.scan(splitLines(normalize(requireText(text))));
    }

    public List<InlineToken> tokenizeInline(String text) {
        return inlineScanner.scan(requireText(text));
    }

    public Node.Root build(List<BlockToken> tokens) {
        return astBuilder.build(tokens);
    }

    public Node.Root parseToAst(String text) {
        return parseToAst(text, false);
    }

    /**
     * Parses text into a tree and applies registered plugins. With {@code useCache} a tree built earlier
     * from the same normalized text is returned as is.
     */
    public Node.Root parseToAst(String text, boolean useCache) {
        String normalized = normalize(requireText(text));
        if (useCache) {
            Optional<Node.Root> cached = cache.get(normalized);
            if (cached.isPresent()) {
                LOGGER.debug("Parse cache hit ({} characters)", normalized.length());
                return cached.get();
            }
        }

        long started = System.nanoTime();
        List<BlockToken> tokens = blockScanner.scan(splitLines(normalized));
        Node.Root root = plugins.apply(astBuilder.build(tokens));
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Parsed {} tokens into {} nodes in {} ms", tokens.size(), root.nodeCount(),
                    (System.nanoTime() - started) / 1_000_000);
        }

        if (useCache) {
            cache.put(normalized, root);
        }
        return root;
    }

    public String parse(String text) {
        return render(text, newHtmlRenderer()).trim();
    }

    public String render(String text, NodeRenderer renderer) {
        Objects.requireNonNull(renderer, "renderer");
        return renderer.render(parseToAst(text));
    }

    public HtmlRenderer newHtmlRenderer() {
        return new HtmlRenderer(options.sanitize(), options.breaks(), options.langPrefix());
    }

    public String exportAsJson(String text) {
        return jsonWriter.write(parseToAst(text));
    }

    public DocumentStatistics statistics(String text) {
        String raw = requireText(text);
        String normalized = normalize(raw);
        List<BlockToken> tokens = blockScanner.scan(splitLines(normalized));
        Node.Root root = plugins.apply(astBuilder.build(tokens));
        return new DocumentStatistics(
                splitLines(normalized).size(),
                raw.length(),
                tokens.size(),
                AstTraversal.countNodes(root),
                AstTraversal.filterByType(root, NodeType.HEADING).size(),
                AstTraversal.filterByType(root, NodeType.LINK).size(),
                AstTraversal.filterByType(root, NodeType.IMAGE).size(),
                AstTraversal.filterByType(root, NodeType.BULLET_LIST).size()
                        + AstTraversal.filterByType(root, NodeType.ORDERED_LIST).size(),
                AstTraversal.filterByType(root, NodeType.CODE_BLOCK).size(),
                AstTraversal.filterByType(root, NodeType.TABLE).size());
    }

    public List<TocEntry> tableOfContents(String text) {
        return TableOfContentsGenerator.generate(parseToAst(text));
    }

    /**
     * Checks that text parses into a structurally valid tree. Never throws.
     */
    public ValidationResult validate(String text) {
        if (text == null) {
            return ValidationResult.invalid(List.of("Input must be text, got null"));
        }
        List<String> errors = new ArrayList<>();
        try {
            List<BlockToken> tokens = tokenize(text);
            astBuilder.validateTokens(tokens);
            errors.addAll(AstValidator.validate(astBuilder.build(tokens)));
        } catch (MarkdownException ex) {
            errors.add(ex.getMessage());
        }
        return errors.isEmpty() ? ValidationResult.ok() : ValidationResult.invalid(errors);
    }

    public void use(String name, AstPlugin plugin) {
        plugins.register(name, plugin);
    }

    public boolean unuse(String name) {
        return plugins.unregister(name);
    }

    public List<String> pluginNames() {
        return plugins.names();
    }

    public void clearCache() {
        cache.clear();
    }

    public int cacheSize() {
        return cache.size();
    }

    static String normalize(String text) {
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    static List<String> splitLines(String normalized) {
        return Arrays.asList(normalized.split("\n", -1));
    }

    private static String requireText(String text) {
        if (text == null) {
            throw new InvalidInputException("Input must be text, got null");
        }
        return text;
    }
}
