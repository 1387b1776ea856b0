package com.scholary.audioqc.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.scholary.audioqc.service.QcOrchestrator;
import com.scholary.audioqc.service.QcResponse;
import com.scholary.audioqc.service.StatusCode;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

class GlobalExceptionHandlerTest {

  private final QcOrchestrator orchestrator = mock(QcOrchestrator.class);
  private final GlobalExceptionHandler handler = new GlobalExceptionHandler(orchestrator);

  @Test
  void handleUploadTooLarge_shouldAnswerInBandFileTooLarge() {
    QcResponse rejection = QcResponse.failure("abc", StatusCode.FILE_TOO_LARGE);
    when(orchestrator.reject(null, StatusCode.FILE_TOO_LARGE)).thenReturn(rejection);

    ResponseEntity<QcResponse> response =
        handler.handleUploadTooLarge(new MaxUploadSizeExceededException(1024));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).isSameAs(rejection);
  }

  @Test
  void handleProcessingFailure_shouldAnswer500WithRequestId() {
    ResponseEntity<ApiError> response =
        handler.handleProcessingFailure(
            new QcProcessingException("req-1", new IllegalStateException("boom")));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().requestId()).isEqualTo("req-1");
    assertThat(response.getBody().error()).isEqualTo("InternalServerError");
    assertThat(response.getBody().message()).doesNotContain("boom");
  }

  @Test
  void handleUnexpected_shouldKeepStatusOfFrameworkErrors() {
    ResponseEntity<ApiError> response =
        handler.handleUnexpected(new HttpRequestMethodNotSupportedException("DELETE"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.METHOD_NOT_ALLOWED);
  }

  @Test
  void handleUnexpected_shouldAnswer500Otherwise() {
    ResponseEntity<ApiError> response = handler.handleUnexpected(new RuntimeException("x"));

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().requestId()).isNull();
  }
}
