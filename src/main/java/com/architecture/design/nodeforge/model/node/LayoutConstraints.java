package com.architecture.design.nodeforge.model.node;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LayoutConstraints {
    private ConstraintType horizontal;
    private ConstraintType vertical;
}
