package com.vtb.attacktree.edit;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

/**
 * Новые значения одного листа; {@code null} очищает поле
 */
@Data
@Builder
@AllArgsConstructor
public class LeafEdit {
    private String leafId;
    private Double probability;
    private Double impact;
}
