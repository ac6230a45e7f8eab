package com.wiredsl.compiler;

import com.wiredsl.compiler.ast.ProjectNode;
import com.wiredsl.compiler.diagnostics.Diagnostic;
import com.wiredsl.compiler.ir.IrGenerator;
import com.wiredsl.compiler.ir.NormalizeResult;
import com.wiredsl.compiler.ir.SemanticError;
import com.wiredsl.compiler.lexer.LexResult;
import com.wiredsl.compiler.lexer.Tokenizer;
import com.wiredsl.compiler.parser.AstBuilder;
import com.wiredsl.compiler.parser.ParseError;
import com.wiredsl.compiler.parser.ParseResult;
import com.wiredsl.compiler.parser.SourceParser;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the compiler front-end: tokenize, parse, build the AST and normalize it to IR.
 * A failing stage stops the pipeline and its problems are returned as diagnostics.
 * <p>
 * Each call creates its own stage objects, so one compiler may be shared between threads.
 */
public class WireCompiler {

    private final CompilerOptions options;

    public WireCompiler() {
        this(CompilerOptions.load());
    }

    public WireCompiler(CompilerOptions options) {
        this.options = options;
    }

    public CompilerOptions getOptions() {
        return options;
    }

    public CompileResult compile(String source) {
        long start = System.nanoTime();

        LexResult lexed = new Tokenizer().tokenize(source);
        if (lexed instanceof LexResult.Failure failure) {
            debugLog("lex failed: " + failure.error().message());
            return new CompileResult.Failure(List.of(failure.error().toDiagnostic()));
        }
        debugLog("lexed " + lexed.tokens().size() + " token(s)");

        ParseResult parsed = new SourceParser().parse(lexed.tokens());
        if (parsed instanceof ParseResult.Failure failure) {
            debugLog("parse failed with " + failure.errors().size() + " error(s)");
            List<Diagnostic> diagnostics = new ArrayList<>();
            for (ParseError error : failure.errors()) {
                diagnostics.add(error.toDiagnostic());
            }
            return new CompileResult.Failure(diagnostics);
        }

        ProjectNode ast = new AstBuilder().build(((ParseResult.Success) parsed).tree());

        IrGenerator generator = new IrGenerator();
        generator.setDebugEnabled(options.debug());
        generator.setStrictUnknownComponents(options.strictUnknownComponents());
        generator.setDefaultDevice(options.defaultDevice());
        NormalizeResult normalized = generator.normalize(ast);

        List<Diagnostic> warnings = toDiagnostics(normalized.warnings());
        if (normalized instanceof NormalizeResult.Failure failure) {
            List<Diagnostic> diagnostics = toDiagnostics(failure.errors());
            diagnostics.addAll(warnings);
            return new CompileResult.Failure(diagnostics);
        }

        debugLog(String.format("compiled \"%s\" in %.2f ms", ast.name(), (System.nanoTime() - start) / 1_000_000.0));
        return new CompileResult.Success(((NormalizeResult.Success) normalized).document(), warnings);
    }

    private static List<Diagnostic> toDiagnostics(List<SemanticError> problems) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (SemanticError problem : problems) {
            diagnostics.add(problem.toDiagnostic());
        }
        return diagnostics;
    }

    private void debugLog(String message) {
        if (options.debug()) {
            System.out.println("[WireCompiler] " + message);
        }
    }
}
