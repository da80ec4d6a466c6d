package com.ryuqq.urengine.core.outcome;

import com.ryuqq.urengine.core.orchestration.ExecStatus;

/**
 * 성공.
 *
 * @param output 출력 텍스트 (null 가능)
 * @param outputNature 출력 종류 (null 가능)
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record Ok(
    String output,
    String outputNature
) implements Outcome {

    public static Ok of(String output) {
        return new Ok(output, null);
    }

    public static Ok empty() {
        return new Ok(null, null);
    }

    @Override
    public int status() {
        return ExecStatus.SUCCESS;
    }
}
