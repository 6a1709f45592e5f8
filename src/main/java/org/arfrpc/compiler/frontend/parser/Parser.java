package org.arfrpc.compiler.frontend.parser;

import org.arfrpc.compiler.diagnostics.Diagnostic;
import org.arfrpc.compiler.diagnostics.DiagnosticsEngine;
import org.arfrpc.compiler.frontend.parser.ast.AnnotationNode;
import org.arfrpc.compiler.frontend.parser.ast.AstNode;
import org.arfrpc.compiler.frontend.parser.ast.EnumNode;
import org.arfrpc.compiler.frontend.parser.ast.FileNode;
import org.arfrpc.compiler.frontend.parser.ast.ImportNode;
import org.arfrpc.compiler.frontend.parser.ast.NodeId;
import org.arfrpc.compiler.frontend.parser.ast.NodeIdAllocator;
import org.arfrpc.compiler.frontend.parser.ast.PackageNode;
import org.arfrpc.compiler.frontend.parser.ast.ServiceNode;
import org.arfrpc.compiler.frontend.parser.ast.StructNode;
import org.arfrpc.compiler.frontend.parser.features.annotation.AnnotationParser;
import org.arfrpc.compiler.model.Token;
import org.arfrpc.compiler.model.TokenType;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recursive-descent parser producing one {@link FileNode} per source file.
 *
 * <p>The parser reports every grammar violation as a {@link Diagnostic.Kind#PARSE} error and
 * recovers in panic mode (see {@link #synchronize()}), so one pass collects all independent
 * errors of a file. The returned tree is best effort; callers must not validate a tree whose
 * file produced errors.</p>
 *
 * <p>Comment tokens never reach the handlers. They are folded into per-token documentation
 * when the parser is created: a run of comment lines directly above a token, with no blank
 * line between them and no code on the same line, documents the declaration starting there.</p>
 */
public class Parser implements ParsingContext {

    private final List<Token> tokens = new ArrayList<>();
    private final List<List<String>> documentation = new ArrayList<>();
    private final String fileName;
    private final DiagnosticsEngine diagnostics;
    private final NodeIdAllocator ids;
    private final DeclarationHandlerRegistry registry;
    private int current = 0;

    /**
     * Creates a parser for one file.
     *
     * @param tokens      The lexer output, including comments and the terminating EOF.
     * @param fileName    The logical file name.
     * @param diagnostics The engine receiving parse errors.
     * @param ids         The allocator shared by every file of the compilation.
     */
    public Parser(List<Token> tokens, String fileName, DiagnosticsEngine diagnostics, NodeIdAllocator ids) {
        this.fileName = fileName;
        this.diagnostics = diagnostics;
        this.ids = ids;
        this.registry = DeclarationHandlerRegistry.initialize();
        foldComments(tokens);
    }

    /**
     * Parses the whole file.
     *
     * @return The file node, possibly partial when errors were reported.
     */
    public FileNode parse() {
        PackageNode packageNode = null;
        if (checkKeyword(Keywords.PACKAGE)) {
            AstNode node = parseDeclaration(parseHeader(null));
            if (node instanceof PackageNode parsed) {
                packageNode = parsed;
            }
        } else {
            error(peek(), "Expected 'package' declaration at the start of the file");
        }

        List<ImportNode> imports = new ArrayList<>();
        while (checkKeyword(Keywords.IMPORT)) {
            AstNode node = parseDeclaration(parseHeader(null));
            if (node instanceof ImportNode importNode) {
                imports.add(importNode);
            }
        }

        List<StructNode> structs = new ArrayList<>();
        List<EnumNode> enums = new ArrayList<>();
        Map<String, ServiceNode> services = new LinkedHashMap<>();

        while (!isAtEnd()) {
            if (check(TokenType.RIGHT_BRACE)) {
                error(advance(), "Unexpected '}'");
                continue;
            }
            DeclarationHeader header = parseHeader(null);
            Token head = peek();
            if (isAtEnd()) {
                if (header.hasAnnotations()) {
                    error(head, "Expected a declaration after annotations");
                }
                break;
            }
            if (head.isKeyword(Keywords.STRUCT) || head.isKeyword(Keywords.ENUM) || head.isKeyword(Keywords.SERVICE)) {
                AstNode node = parseDeclaration(header);
                if (node instanceof StructNode struct) {
                    structs.add(struct);
                } else if (node instanceof EnumNode enumNode) {
                    enums.add(enumNode);
                } else if (node instanceof ServiceNode service) {
                    ServiceNode existing = services.get(service.name().text());
                    if (existing == null) {
                        services.put(service.name().text(), service);
                    } else {
                        existing.reopen(service);
                    }
                }
            } else if (head.isKeyword(Keywords.IMPORT)) {
                error(head, "Imports must appear before any struct, enum or service declaration");
                parseDeclaration(header);
            } else if (head.isKeyword(Keywords.PACKAGE)) {
                error(head, "Duplicate package declaration");
                parseDeclaration(header);
            } else if (head.isKeyword(Keywords.UNION)) {
                error(head, "A union can only be declared inside a struct");
                parseDeclaration(header);
            } else {
                error(head, "Expected 'struct', 'enum' or 'service' but found '" + head.text() + "'");
                synchronize();
            }
        }

        return new FileNode(fileName, packageNode, imports, structs, enums, new ArrayList<>(services.values()));
    }

    // --- ParsingContext ---

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        if (isAtEnd()) return type == TokenType.EOF;
        return peek().type() == type;
    }

    @Override
    public boolean checkKeyword(String keyword) {
        return peek().isKeyword(keyword);
    }

    @Override
    public Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token peekAhead(int offset) {
        int index = Math.min(current + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    @Override
    public Token previous() {
        if (current == 0) return null;
        return tokens.get(current - 1);
    }

    @Override
    public Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        error(peek(), errorMessage);
        return null;
    }

    @Override
    public void error(Token token, String message) {
        diagnostics.reportError(Diagnostic.Kind.PARSE, message, token);
    }

    @Override
    public void synchronize() {
        while (!isAtEnd()) {
            if (check(TokenType.RIGHT_BRACE)) {
                return;
            }
            Token skipped = advance();
            if (skipped.type() == TokenType.SEMICOLON || peek().line() > skipped.line()) {
                return;
            }
        }
    }

    @Override
    public DeclarationHeader parseHeader(NodeId parentId) {
        List<String> docs = documentation.get(current);
        List<AnnotationNode> annotations = AnnotationParser.parseAnnotations(this);
        return new DeclarationHeader(parentId, annotations, docs);
    }

    @Override
    public boolean atDeclarationKeyword() {
        return check(TokenType.IDENTIFIER) && registry.get(peek().text()).isPresent();
    }

    @Override
    public AstNode parseDeclaration(DeclarationHeader header) {
        Optional<IDeclarationHandler> handler = registry.get(peek().text());
        if (handler.isEmpty()) {
            error(peek(), "Expected a declaration but found '" + peek().text() + "'");
            synchronize();
            return null;
        }
        AstNode node = handler.get().parse(this, header);
        if (node == null) {
            synchronize();
        }
        return node;
    }

    @Override
    public NodeId nextId() {
        return ids.next();
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private void foldComments(List<Token> raw) {
        List<Token> run = new ArrayList<>();
        int lastCodeLine = 0;
        for (Token token : raw) {
            if (token.type() == TokenType.COMMENT) {
                if (token.line() == lastCodeLine) {
                    // trailing comment after code on the same line
                    run.clear();
                    continue;
                }
                if (!run.isEmpty() && run.get(run.size() - 1).line() != token.line() - 1) {
                    run.clear();
                }
                run.add(token);
                continue;
            }
            boolean attached = !run.isEmpty() && run.get(run.size() - 1).line() == token.line() - 1;
            documentation.add(attached ? run.stream().map(t -> (String) t.value()).toList() : List.of());
            tokens.add(token);
            run.clear();
            lastCodeLine = token.line();
        }
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            Token last = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
            int line = last == null ? 1 : last.line();
            tokens.add(new Token(TokenType.EOF, "", null, line, 1, fileName));
            documentation.add(List.of());
        }
    }
}
