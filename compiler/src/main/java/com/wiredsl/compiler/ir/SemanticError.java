package com.wiredsl.compiler.ir;

import com.wiredsl.compiler.ast.Node.SourceLocation;
import com.wiredsl.compiler.diagnostics.Diagnostic;
import com.wiredsl.compiler.diagnostics.Severity;

import java.util.List;

/**
 * Problems found while normalizing the AST into IR.
 * Warnings share this hierarchy; they are reported but never block generation.
 */
public sealed interface SemanticError {

    String code();

    String message();

    SourceLocation location();

    default Severity severity() {
        return Severity.ERROR;
    }

    default String suggestion() {
        return null;
    }

    default boolean isError() {
        return severity() == Severity.ERROR;
    }

    default Diagnostic toDiagnostic() {
        SourceLocation loc = location();
        return new Diagnostic(code(), message(),
            loc == null ? null : loc.line(),
            loc == null ? null : loc.column(),
            severity(), suggestion());
    }

    /**
     * A definition reaches itself. The path starts and ends with the same name.
     */
    record CircularDefinition(List<String> path, SourceLocation location) implements SemanticError {
        public CircularDefinition {
            path = List.copyOf(path);
        }

        @Override
        public String code() {
            return "CIRCULAR_DEFINITION";
        }

        @Override
        public String message() {
            return "Circular component definition: " + String.join(" -> ", path);
        }
    }

    record UndefinedComponent(String name, String closestMatch, Severity severity, SourceLocation location)
        implements SemanticError {

        @Override
        public String code() {
            return "UNDEFINED_COMPONENT";
        }

        @Override
        public String message() {
            return "Component \"" + name + "\" is neither built in nor defined";
        }

        @Override
        public String suggestion() {
            return closestMatch != null
                ? "did you mean \"" + closestMatch + "\"?"
                : "define it with: define Component \"" + name + "\" { ... }";
        }
    }

    record UnknownLayout(String name, String closestMatch, SourceLocation location) implements SemanticError {
        @Override
        public String code() {
            return "UNKNOWN_LAYOUT";
        }

        @Override
        public String message() {
            return "Unknown layout type \"" + name + "\"";
        }

        @Override
        public String suggestion() {
            return closestMatch != null ? "did you mean \"" + closestMatch + "\"?" : "use stack, grid, split, panel or card";
        }
    }

    record MissingProperty(String owner, String property, SourceLocation location) implements SemanticError {
        @Override
        public String code() {
            return "MISSING_PROPERTY";
        }

        @Override
        public String message() {
            return owner + " requires property \"" + property + "\"";
        }
    }

    record UnknownProperty(String owner, String property, String closestMatch, SourceLocation location)
        implements SemanticError {

        @Override
        public String code() {
            return "UNKNOWN_PROPERTY";
        }

        @Override
        public String message() {
            return owner + " has no property \"" + property + "\"";
        }

        @Override
        public String suggestion() {
            return closestMatch == null ? null : "did you mean \"" + closestMatch + "\"?";
        }
    }

    record InvalidValue(String owner, String property, String value, String expected, SourceLocation location)
        implements SemanticError {

        @Override
        public String code() {
            return "INVALID_VALUE";
        }

        @Override
        public String message() {
            return "Invalid value \"" + value + "\" for " + owner + "." + property;
        }

        @Override
        public String suggestion() {
            return "expected " + expected;
        }
    }

    record OutOfRange(String owner, String property, double value, Double min, Double max, SourceLocation location)
        implements SemanticError {

        @Override
        public String code() {
            return "OUT_OF_RANGE";
        }

        @Override
        public String message() {
            return owner + "." + property + " = " + com.wiredsl.compiler.ast.PropValue.formatNumber(value)
                + " is out of range" + bounds();
        }

        private String bounds() {
            if (min != null && max != null) {
                return " [" + com.wiredsl.compiler.ast.PropValue.formatNumber(min) + ", "
                    + com.wiredsl.compiler.ast.PropValue.formatNumber(max) + "]";
            } else if (min != null) {
                return " (minimum " + com.wiredsl.compiler.ast.PropValue.formatNumber(min) + ")";
            } else if (max != null) {
                return " (maximum " + com.wiredsl.compiler.ast.PropValue.formatNumber(max) + ")";
            }
            return "";
        }
    }

    /**
     * Shape rules such as "split has exactly two children".
     */
    record StructuralViolation(String code, String message, SourceLocation location) implements SemanticError {}

    record DuplicateDefinition(String name, SourceLocation location) implements SemanticError {
        @Override
        public String code() {
            return "DUPLICATE_DEFINITION";
        }

        @Override
        public String message() {
            return "Component \"" + name + "\" is defined more than once";
        }
    }

    /**
     * A {@code prop_x} binding in a definition body has no matching argument at the call site.
     * Fatal only when the bound property is required.
     */
    record MissingArgument(String definition, String argument, String owner, String property, boolean required,
                           SourceLocation location) implements SemanticError {

        @Override
        public String code() {
            return required ? "MISSING_ARGUMENT" : "OMITTED_PROPERTY";
        }

        @Override
        public Severity severity() {
            return required ? Severity.ERROR : Severity.WARNING;
        }

        @Override
        public String message() {
            return required
                ? "Missing required argument \"" + argument + "\" for " + owner + "." + property
                    + " while expanding \"" + definition + "\""
                : "Optional " + owner + "." + property + " omitted because argument \"" + argument
                    + "\" was not passed to \"" + definition + "\"";
        }
    }

    record UnusedArgument(String definition, String argument, SourceLocation location) implements SemanticError {
        @Override
        public String code() {
            return "UNUSED_ARGUMENT";
        }

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }

        @Override
        public String message() {
            return "Argument \"" + argument + "\" is not used by \"" + definition + "\"";
        }
    }

    record ShadowedBuiltIn(String name, SourceLocation location) implements SemanticError {
        @Override
        public String code() {
            return "SHADOWED_BUILTIN";
        }

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }

        @Override
        public String message() {
            return "Definition \"" + name + "\" has the name of a built-in component and is never expanded";
        }
    }

    record NamingStyle(String name, SourceLocation location) implements SemanticError {
        @Override
        public String code() {
            return "NAMING_STYLE";
        }

        @Override
        public Severity severity() {
            return Severity.WARNING;
        }

        @Override
        public String message() {
            return "Component name \"" + name + "\" should be PascalCase";
        }
    }
}
