package com.vtb.attacktree.models;

import lombok.Builder;
import lombok.Data;

/**
 * Вклад листа в ожидаемый ущерб: вероятность × ущерб
 */
@Data
@Builder
public class Contributor {
    private String id;
    private String label;
    private double value;
}
