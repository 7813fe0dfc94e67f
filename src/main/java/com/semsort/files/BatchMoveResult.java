package com.semsort.files;

import java.util.List;

public record BatchMoveResult(String batchId, List<MoveRequest> completed, List<String> errors, boolean rolledBack) {

    public boolean success() {
        return errors.isEmpty();
    }
}
