package io.todoflow.taskevents.realtime;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** Thrown when a WebSocket handshake token is missing, invalid or expired. */
public class WebSocketAuthException extends ErrorResponseException {

  public WebSocketAuthException(String detail) {
    super(HttpStatus.UNAUTHORIZED, createProblem(detail), null);
  }

  private static ProblemDetail createProblem(String detail) {
    var problem = ProblemDetail.forStatus(HttpStatus.UNAUTHORIZED);
    problem.setTitle("WebSocket authentication failed");
    problem.setDetail(detail);
    return problem;
  }
}
