/**
 * 오류 분류 패키지.
 *
 * <p>사용자에게 보이는 모든 실패는 {@link com.ryuqq.bay.core.error.BayException} 하위 타입이며
 * 안정적인 {@link com.ryuqq.bay.core.error.ErrorCode}를 가집니다.</p>
 *
 * @since 1.0.0
 * @author Bay Team
 */
package com.ryuqq.bay.core.error;
