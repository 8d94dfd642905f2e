package com.shapecraft.generator.codegen.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Template model of one generated DTO field; every value is Java source text.
 */
@Value
@Builder
public class DtoFieldView {
    String name;
    String type;
    String getter;
    String setter;
    String lineage;
    String equalsExpression;
    String hashExpression;
    String toStringExpression;
}
