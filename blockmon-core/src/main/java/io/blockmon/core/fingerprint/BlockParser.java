package io.blockmon.core.fingerprint;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Range;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Splits a source file into {@link Block}s.
 *
 * <p>For Java sources (parsed with JavaParser) the blocks are:
 * <ol>
 *   <li><strong>Module block:</strong> the whole compilation unit with every
 *       outermost method, constructor and initializer body collapsed to
 *       {@code {}}. It holds the package, imports, type headers, fields and
 *       member signatures, so adding or removing a method changes it.</li>
 *   <li><strong>Method blocks:</strong> one per body, with its own nested
 *       bodies (methods of local and anonymous classes) collapsed in turn.</li>
 * </ol>
 * Blocks are returned in preorder: module first, then bodies in source order,
 * each parent before its children. Class bodies are not blocks.
 *
 * <p>A file that fails to parse yields an unparseable {@link Module} with no
 * blocks. Files whose extension is not a source extension are a single block
 * spanning the whole file, checksummed without comment stripping.
 */
public final class BlockParser {

    private static final Logger log = LoggerFactory.getLogger(BlockParser.class);

    private static final String COLLAPSED_BODY = "{}";

    private final JavaParser parser;

    public BlockParser() {
        this.parser = new JavaParser(new ParserConfiguration()
                .setLanguageLevel(ParserConfiguration.LanguageLevel.BLEEDING_EDGE));
    }

    /**
     * Parses {@code source} as a Java compilation unit.
     *
     * @param filename relative filename, used for naming only
     * @param source   file content
     * @return the module; never null
     */
    public Module parse(String filename, String source) {
        ParseResult<CompilationUnit> result;
        try {
            result = parser.parse(source);
        } catch (RuntimeException e) {
            log.debug("Parser failure on {}: {}", filename, e.getMessage());
            return Module.unparseable(filename);
        }
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            log.debug("Syntax error in {}: {}", filename, result.getProblems());
            return Module.unparseable(filename);
        }

        LineIndex index = new LineIndex(source);
        List<Body> bodies = collectBodies(result.getResult().get(), index);
        return new Module(filename, toBlocks(source, index, bodies), true);
    }

    /** A single block spanning the whole file. */
    public Module parseWholeFile(String filename, String content) {
        int lines = Math.max(1, new LineIndex(content).lineCount());
        Block block = new Block(Block.MODULE_BLOCK_NAME, 1, lines, 0, content, Checksums.checksum(content));
        return new Module(filename, List.of(block), true);
    }

    // ── Body collection ─────────────────────────────────────────────────

    private static final class Body {
        final String name;
        final int start;
        final int end;
        final int startLine;
        final int endLine;
        final List<Body> children = new ArrayList<>();
        int depth;

        Body(String name, int start, int end, int startLine, int endLine) {
            this.name = name;
            this.start = start;
            this.end = end;
            this.startLine = startLine;
            this.endLine = endLine;
        }

        boolean contains(Body other) {
            return other.start >= start && other.end <= end;
        }
    }

    private List<Body> collectBodies(CompilationUnit cu, LineIndex index) {
        List<Body> flat = new ArrayList<>();
        for (MethodDeclaration method : cu.findAll(MethodDeclaration.class)) {
            method.getBody().ifPresent(body -> addBody(flat, qualifiedName(method, method.getNameAsString()), body, index));
        }
        for (ConstructorDeclaration ctor : cu.findAll(ConstructorDeclaration.class)) {
            addBody(flat, qualifiedName(ctor, "<init>"), ctor.getBody(), index);
        }
        for (CompactConstructorDeclaration ctor : cu.findAll(CompactConstructorDeclaration.class)) {
            addBody(flat, qualifiedName(ctor, "<init>"), ctor.getBody(), index);
        }
        for (InitializerDeclaration init : cu.findAll(InitializerDeclaration.class)) {
            addBody(flat, qualifiedName(init, init.isStatic() ? "<clinit>" : "<instinit>"), init.getBody(), index);
        }
        flat.sort(Comparator.comparingInt((Body b) -> b.start).thenComparingInt(b -> -b.end));

        // Arrange into a forest by range containment.
        List<Body> ordered = new ArrayList<>();
        Deque<Body> open = new ArrayDeque<>();
        for (Body body : flat) {
            while (!open.isEmpty() && !open.peek().contains(body)) {
                open.pop();
            }
            if (!open.isEmpty()) {
                open.peek().children.add(body);
            }
            body.depth = open.size() + 1;
            open.push(body);
            ordered.add(body);
        }
        return ordered;
    }

    private static void addBody(List<Body> flat, String name, BlockStmt body, LineIndex index) {
        Optional<Range> range = body.getRange();
        if (range.isEmpty()) {
            return;
        }
        Range r = range.get();
        int start = index.offset(r.begin.line, r.begin.column);
        int end = index.offset(r.end.line, r.end.column) + 1;
        flat.add(new Body(name, start, end, r.begin.line, r.end.line));
    }

    private static String qualifiedName(Node member, String simpleName) {
        Deque<String> parts = new ArrayDeque<>();
        parts.push(simpleName);
        Optional<Node> current = member.getParentNode();
        while (current.isPresent()) {
            Node node = current.get();
            if (node instanceof TypeDeclaration<?> type) {
                parts.push(type.getNameAsString());
            } else if (node instanceof ObjectCreationExpr creation && creation.getAnonymousClassBody().isPresent()) {
                parts.push(creation.getTypeAsString() + "$anon");
            } else if (node instanceof CallableDeclaration<?> callable) {
                parts.push(callable.getNameAsString());
            }
            current = node.getParentNode();
        }
        return String.join(".", parts);
    }

    // ── Block construction ──────────────────────────────────────────────

    private List<Block> toBlocks(String source, LineIndex index, List<Body> bodies) {
        List<Block> blocks = new ArrayList<>(bodies.size() + 1);

        List<Body> roots = new ArrayList<>();
        for (Body body : bodies) {
            if (body.depth == 1) {
                roots.add(body);
            }
        }
        String moduleText = CommentStripper.strip(collapse(source, 0, source.length(), roots));
        blocks.add(new Block(Block.MODULE_BLOCK_NAME, 1, Math.max(1, index.lineCount()), 0,
                moduleText, Checksums.checksum(moduleText)));

        for (Body body : bodies) {
            String text = CommentStripper.strip(collapse(source, body.start, body.end, body.children));
            blocks.add(new Block(body.name, body.startLine, body.endLine, body.depth,
                    text, Checksums.checksum(text)));
        }
        return blocks;
    }

    private static String collapse(String source, int start, int end, List<Body> children) {
        StringBuilder sb = new StringBuilder(end - start);
        int pos = start;
        for (Body child : children) {
            sb.append(source, pos, child.start);
            sb.append(COLLAPSED_BODY);
            pos = child.end;
        }
        sb.append(source, pos, end);
        return sb.toString();
    }

    /** Converts JavaParser's 1-based line/column positions into string offsets. */
    private static final class LineIndex {
        private final int[] lineStarts;
        private final int length;

        LineIndex(String text) {
            List<Integer> starts = new ArrayList<>();
            starts.add(0);
            for (int i = 0; i < text.length(); i++) {
                char c = text.charAt(i);
                if (c == '\n') {
                    starts.add(i + 1);
                } else if (c == '\r' && (i + 1 >= text.length() || text.charAt(i + 1) != '\n')) {
                    starts.add(i + 1);
                }
            }
            this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
            this.length = text.length();
        }

        int offset(int line, int column) {
            int lineStart = lineStarts[Math.min(line, lineStarts.length) - 1];
            return Math.min(lineStart + column - 1, length - 1);
        }

        int lineCount() {
            if (length == 0) {
                return 0;
            }
            // a trailing newline does not start a new line of content
            return lineStarts[lineStarts.length - 1] == length ? lineStarts.length - 1 : lineStarts.length;
        }
    }
}
