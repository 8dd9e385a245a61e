/**
 * 설정 record 패키지.
 *
 * <p>모든 설정은 불변 record이며, 인자 없는 생성자가 기본값을, compact constructor가
 * 유효성 검증을, {@code withX(...)} 메서드가 부분 변경을 제공합니다.
 * 파일/환경변수에서 읽어오는 것은 이 패키지의 책임이 아닙니다.</p>
 *
 * @since 1.0.0
 * @author Bay Team
 */
package com.ryuqq.bay.core.config;
