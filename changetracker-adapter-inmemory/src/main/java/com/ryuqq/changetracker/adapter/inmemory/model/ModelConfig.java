package com.ryuqq.changetracker.adapter.inmemory.model;

/**
 * InMemoryModel 빌드 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>validateKeyComparators: 빌드 시 모든 primary key property의 comparator를 미리 생성 (기본 true)</li>
 * </ul>
 *
 * <p>검증을 켜 두면 비교 불가능한 key 타입이 첫 비교 시점이 아니라 모델 빌드 시점에 실패합니다.</p>
 *
 * @author ChangeTracker Team
 * @since 1.0.0
 * @param validateKeyComparators key comparator 사전 검증 여부
 */
public record ModelConfig(boolean validateKeyComparators) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: validateKeyComparators=true</p>
     */
    public ModelConfig() {
        this(true);
    }

    /**
     * validateKeyComparators만 변경한 새 인스턴스 생성.
     *
     * @param validateKeyComparators key comparator 사전 검증 여부
     * @return 새 ModelConfig 인스턴스
     */
    public ModelConfig withValidateKeyComparators(boolean validateKeyComparators) {
        return new ModelConfig(validateKeyComparators);
    }
}
