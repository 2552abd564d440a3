package com.vtb.attacktree.edit;

import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Итог применения правок: сколько полей записано и сообщения по отклонённым полям
 */
@Data
@Builder
public class EditOutcome {
    @Builder.Default
    private int updatedFields = 0;
    @Builder.Default
    private List<String> errors = new ArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
