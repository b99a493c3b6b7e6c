package com.ryuqq.changetracker.core.debug;

/**
 * Debug 출력 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>includeProperties: entry마다 모든 property 값을 별도 줄로 출력 (기본 false)</li>
 * </ul>
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 * @param includeProperties property 줄 출력 여부
 */
public record DebugStringOptions(boolean includeProperties) {

    /**
     * 한 줄 요약: entity type, key 값, 상태.
     */
    public static final DebugStringOptions SHORT_DEFAULT = new DebugStringOptions(false);

    /**
     * 요약 + property 줄.
     */
    public static final DebugStringOptions LONG_DEFAULT = new DebugStringOptions(true);

    /**
     * 기본 설정 생성자 ({@link #SHORT_DEFAULT}와 동일).
     */
    public DebugStringOptions() {
        this(false);
    }

    /**
     * includeProperties만 변경한 새 인스턴스 생성.
     *
     * @param includeProperties property 줄 출력 여부
     * @return 새 DebugStringOptions 인스턴스
     */
    public DebugStringOptions withIncludeProperties(boolean includeProperties) {
        return new DebugStringOptions(includeProperties);
    }
}
