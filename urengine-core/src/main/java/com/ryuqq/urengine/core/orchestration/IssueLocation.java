package com.ryuqq.urengine.core.orchestration;

/**
 * Issue가 가리키는 입력 위치.
 *
 * @param row 행 번호 (null 가능)
 * @param column 열 이름 (null 가능)
 * @param invalidValue 문제 값 (null 가능)
 *
 * @author Resource Engine Team
 * @since 1.0.0
 */
public record IssueLocation(Integer row, String column, String invalidValue) {

    public static IssueLocation of(int row, String column) {
        return new IssueLocation(row, column, null);
    }
}
