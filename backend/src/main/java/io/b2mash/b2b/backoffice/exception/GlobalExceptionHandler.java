package io.b2mash.b2b.backoffice.exception;

import io.b2mash.b2b.backoffice.frequency.InvalidScheduleDateException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

@ControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(InvalidScheduleDateException.class)
  public ResponseEntity<ProblemDetail> handleInvalidScheduleDate(
      InvalidScheduleDateException ex, HttpServletRequest request) {
    log.warn(
        "Invalid date argument: path={}, argument={}, value={}",
        request.getRequestURI(),
        ex.getArgument(),
        ex.getValue());

    var problem = ProblemDetail.forStatus(HttpStatus.BAD_REQUEST);
    problem.setTitle("Invalid date argument");
    problem.setDetail(ex.getMessage());
    problem.setProperty("argument", ex.getArgument());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problem);
  }
}
