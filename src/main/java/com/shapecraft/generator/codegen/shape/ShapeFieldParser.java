package com.shapecraft.generator.codegen.shape;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.shapecraft.generator.codegen.exception.UnresolvedTypeException;
import com.shapecraft.generator.codegen.model.SourcePath;
import com.shapecraft.generator.codegen.model.core.context.DiagnosticCode;
import com.shapecraft.generator.model.ExprNode;
import com.shapecraft.generator.model.ExprQueries;
import com.shapecraft.generator.model.ParameterNode;
import com.shapecraft.generator.schema.TypeRef;

/**
 * Extracts name, type, lineage and source path of one shape entry. A type
 * failure stays local to the field: it is kept as an untyped pass-through.
 */
public class ShapeFieldParser {
    private static final Logger log = LoggerFactory.getLogger(ShapeFieldParser.class);

    private final AnalysisContext ctx;

    public ShapeFieldParser(AnalysisContext ctx) {
        this.ctx = ctx;
    }

    public ParsedField parse(String name, ExprNode expression, Scope scope) {
        TypeRef type;
        int mark = ctx.mark();
        ctx.getHints().push(name);
        try {
            type = ctx.getTypeResolver().typeOf(expression, scope);
            if (type.isStream()) {
                type = TypeRef.list(type.getElementType());
            }
        } catch (UnresolvedTypeException e) {
            ctx.rollback(mark);
            ctx.getDiagnostics().warning(DiagnosticCode.UNRESOLVED_TYPE, ctx.location(expression),
                    "Field '" + name + "': " + e.getMessage() + "; passed through as Object");
            log.warn("Unresolved type for field '{}' at {}: {}", name, ctx.location(expression), e.getMessage());
            type = TypeRef.UNRESOLVED;
        } finally {
            ctx.getHints().pop();
        }

        return new ParsedField(name, expression, type, lineage(expression, scope), sourcePath(expression, scope));
    }

    /**
     * Member chain from the structure parameter, made relative to the structure's anchor.
     */
    static SourcePath sourcePath(ExprNode expression, Scope scope) {
        if (scope.getAnchor() == null) {
            return null;
        }
        Optional<List<String>> members = ExprQueries.memberPath(expression, scope.getStructureParameter());
        if (members.isEmpty() || members.get().isEmpty()) {
            return null;
        }
        return SourcePath.of(members.get()).relativeTo(scope.getAnchor())
                .filter(path -> !path.isEmpty())
                .orElse(null);
    }

    static String lineage(ExprNode expression, Scope scope) {
        String text = expression.toSource();
        ExprNode base = ExprQueries.chainBase(expression);
        if (base instanceof ParameterNode parameter && parameter.getName().equals(scope.getStructureParameter())
                && text.startsWith(parameter.getName())) {
            TypeRef source = scope.structureSourceType();
            String root = source != null ? source.simpleName() : parameter.getName();
            return root + text.substring(parameter.getName().length());
        }
        return text;
    }
}
