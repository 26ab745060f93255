package com.architecture.design.nodeforge.dto;

import com.architecture.design.nodeforge.dto.style.StyleResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NodeStyleReport {
    private String nodeId;
    private String nodeName;
    private StyleResult result;
}
