package com.system.allocator.schemas;

import lombok.*;
import java.util.List;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatrixAssignmentRequest {
    private List<List<Double>> matrix;
    // Optional, placeholders are generated when absent
    private List<String> rowNames;
    private List<String> colNames;
    private GeneticOptionsSchema options;
}
