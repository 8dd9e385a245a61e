package com.ryuqq.bay.adapter.runner;

import com.ryuqq.bay.core.error.DriverException;
import com.ryuqq.bay.core.error.ErrorCode;
import com.ryuqq.bay.core.error.OperationTimeoutException;
import com.ryuqq.bay.core.error.ValidationException;
import com.ryuqq.bay.core.spi.ComputeDriver;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * TimeoutComputeDriver 유닛 테스트.
 *
 * @author Bay Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class TimeoutComputeDriverTest {

    @Mock
    private ComputeDriver delegate;

    private TimeoutComputeDriver driver;

    @BeforeEach
    void setUp() {
        driver = new TimeoutComputeDriver(delegate, 200);
    }

    @AfterEach
    void tearDown() {
        driver.close();
    }

    @Test
    void 정상_호출은_결과를_그대로_반환() {
        // given
        when(delegate.createVolume(anyString(), anyMap())).thenReturn("vol-1");

        // when
        String volumeRef = driver.createVolume("bay-ws-1", Map.of());

        // then
        assertThat(volumeRef).isEqualTo("vol-1");
        verify(delegate).createVolume("bay-ws-1", Map.of());
    }

    @Test
    void 호출이_멈추면_timeout_으로_변환() {
        // given
        doAnswer(invocation -> {
            Thread.sleep(5_000);
            return null;
        }).when(delegate).destroy("inst-1");

        // when & then
        assertThatThrownBy(() -> driver.destroy("inst-1"))
            .isInstanceOf(OperationTimeoutException.class)
            .satisfies(e -> assertThat(((OperationTimeoutException) e).getErrorCode()).isEqualTo(ErrorCode.TIMEOUT));
    }

    @Test
    void 드라이버_예외는_driver_error_로_변환() {
        // given
        doThrow(new RuntimeException("engine unreachable")).when(delegate).deleteVolume("vol-1");

        // when & then
        assertThatThrownBy(() -> driver.deleteVolume("vol-1"))
            .isInstanceOf(DriverException.class)
            .hasMessageContaining("engine unreachable")
            .hasCauseInstanceOf(RuntimeException.class);
    }

    @Test
    void 이미_분류된_예외는_그대로_전달() {
        // given
        ValidationException invalid = new ValidationException("bad image");
        doThrow(invalid).when(delegate).stop("inst-1");

        // when & then
        assertThatThrownBy(() -> driver.stop("inst-1")).isSameAs(invalid);
    }

    @Test
    void 잘못된_생성자_인자는_거부() {
        assertThatThrownBy(() -> new TimeoutComputeDriver(null, 100))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TimeoutComputeDriver(delegate, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
