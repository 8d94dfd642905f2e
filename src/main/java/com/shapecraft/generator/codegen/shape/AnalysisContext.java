package com.shapecraft.generator.codegen.shape;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.shapecraft.generator.codegen.GeneratorConfig;
import com.shapecraft.generator.codegen.StructuralSignatureCalculator;
import com.shapecraft.generator.codegen.model.CallSite;
import com.shapecraft.generator.codegen.model.Structure;
import com.shapecraft.generator.codegen.model.core.context.ToolDiagnostics;
import com.shapecraft.generator.model.ExprNode;
import com.shapecraft.generator.model.ShapeNode;
import com.shapecraft.generator.model.SourcePosition;
import com.shapecraft.generator.schema.TypeNameResolver;
import com.shapecraft.generator.schema.TypeRef;
import com.shapecraft.generator.schema.TypeSchema;

import lombok.Getter;

/**
 * Working state of the analysis of a single call site. Never shared between
 * call sites; the schema is the only thing it reads that others read too.
 */
@Getter
public class AnalysisContext {
    private final CallSite callSite;
    private final TypeSchema schema;
    private final GeneratorConfig config;
    private final ToolDiagnostics diagnostics;
    private final StructuralSignatureCalculator calculator;
    private final TypeNameResolver names;

    private final TypeResolver typeResolver;
    private final NullabilityResolver nullabilityResolver;
    private final ShapeFieldParser fieldParser;
    private final NestedProjectionResolver nestedResolver;
    private final StructureBuilder structureBuilder;

    private final Map<ExprNode, TypeRef> types = new IdentityHashMap<>();
    private final Map<ShapeNode, Structure> structures = new IdentityHashMap<>();
    private final List<ShapeNode> registrationOrder = new ArrayList<>();
    private final Deque<String> hints = new ArrayDeque<>();
    /** While set, shape literals are typed as untyped maps and no structure is built. */
    private boolean structuresSuppressed;

    public AnalysisContext(CallSite callSite, TypeSchema schema, GeneratorConfig config) {
        this.callSite = callSite;
        this.schema = schema;
        this.config = config;
        this.diagnostics = new ToolDiagnostics();
        this.calculator = new StructuralSignatureCalculator(config.getHashLength());
        this.names = TypeNameResolver.forSchema(callSite.getImports(), callSite.getPackageName(), schema);
        this.typeResolver = new TypeResolver(this);
        this.nullabilityResolver = new NullabilityResolver(schema);
        this.fieldParser = new ShapeFieldParser(this);
        this.nestedResolver = new NestedProjectionResolver(this);
        this.structureBuilder = new StructureBuilder(this);
    }

    public void register(ShapeNode shape, Structure structure) {
        if (structures.put(shape, structure) == null) {
            registrationOrder.add(shape);
        }
    }

    /**
     * Savepoint for {@link #rollback(int)}.
     */
    public int mark() {
        return registrationOrder.size();
    }

    /**
     * Forgets the structures registered since {@code mark}.
     */
    public void rollback(int mark) {
        while (registrationOrder.size() > mark) {
            structures.remove(registrationOrder.remove(registrationOrder.size() - 1));
        }
    }

    /**
     * Structures in registration order: nested ones before the structures containing them.
     */
    public List<Structure> structuresInOrder() {
        List<Structure> ordered = new ArrayList<>();
        registrationOrder.forEach(shape -> ordered.add(structures.get(shape)));
        return Collections.unmodifiableList(ordered);
    }

    public void setStructuresSuppressed(boolean structuresSuppressed) {
        this.structuresSuppressed = structuresSuppressed;
    }

    public String currentHint() {
        return hints.isEmpty() ? "Shape" : hints.peek();
    }

    public String location(ExprNode node) {
        SourcePosition position = node.getPosition();
        if (position == null || position.getLine() <= 0) {
            return callSite.location();
        }
        return callSite.getSourceFile() + ":" + position;
    }
}
