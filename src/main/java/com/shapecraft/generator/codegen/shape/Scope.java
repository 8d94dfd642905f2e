package com.shapecraft.generator.codegen.shape;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.shapecraft.generator.codegen.model.SourcePath;
import com.shapecraft.generator.schema.TypeRef;

import lombok.Getter;

/**
 * Names visible while analysing one structure.
 */
@Getter
public class Scope {
    /** Parameter the current structure's fields are read from. */
    private final String structureParameter;
    private final Map<String, TypeRef> parameters;
    private final Map<String, TypeRef> captures;
    /**
     * Member chain from {@link #structureParameter} to the current structure's
     * source object; null when the structure has no single source object.
     */
    private final SourcePath anchor;

    private Scope(String structureParameter, Map<String, TypeRef> parameters, Map<String, TypeRef> captures,
                  SourcePath anchor) {
        this.structureParameter = structureParameter;
        this.parameters = Collections.unmodifiableMap(parameters);
        this.captures = Collections.unmodifiableMap(captures);
        this.anchor = anchor;
    }

    public static Scope root(String parameter, TypeRef sourceType, Map<String, TypeRef> captures) {
        Map<String, TypeRef> parameters = new LinkedHashMap<>();
        parameters.put(parameter, sourceType);
        return new Scope(parameter, parameters, new LinkedHashMap<>(captures), SourcePath.EMPTY);
    }

    /**
     * Scope inside a lambda: {@code name} shadows any outer parameter of that name.
     */
    public Scope withParameter(String name, TypeRef type) {
        Map<String, TypeRef> parameters = new LinkedHashMap<>(this.parameters);
        parameters.put(name, type);
        return new Scope(structureParameter, parameters, new LinkedHashMap<>(captures), anchor);
    }

    /**
     * Scope of a structure built from each element bound to {@code parameter}.
     */
    public Scope forElement(String parameter, TypeRef elementType) {
        Map<String, TypeRef> parameters = new LinkedHashMap<>(this.parameters);
        parameters.put(parameter, elementType);
        return new Scope(parameter, parameters, new LinkedHashMap<>(captures), SourcePath.EMPTY);
    }

    /**
     * Scope of a nested object built from the same parameter, anchored at {@code absoluteAnchor}.
     */
    public Scope anchoredAt(SourcePath absoluteAnchor) {
        return new Scope(structureParameter, new LinkedHashMap<>(parameters), new LinkedHashMap<>(captures),
                absoluteAnchor);
    }

    public TypeRef structureSourceType() {
        return parameters.get(structureParameter);
    }
}
