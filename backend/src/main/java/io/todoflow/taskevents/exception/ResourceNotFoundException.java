package io.todoflow.taskevents.exception;

import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/** A task, reminder or rule that does not exist or was soft-deleted. */
public class ResourceNotFoundException extends ErrorResponseException {

  private final UUID resourceId;

  public ResourceNotFoundException(String resourceType, UUID resourceId) {
    super(HttpStatus.NOT_FOUND, createProblem(resourceType, resourceId), null);
    this.resourceId = resourceId;
  }

  public UUID getResourceId() {
    return resourceId;
  }

  private static ProblemDetail createProblem(String resourceType, UUID resourceId) {
    var problem = ProblemDetail.forStatus(HttpStatus.NOT_FOUND);
    problem.setTitle(resourceType + " not found");
    problem.setDetail("No " + resourceType.toLowerCase() + " found with id " + resourceId);
    problem.setProperty("resourceType", resourceType);
    problem.setProperty("resourceId", resourceId.toString());
    return problem;
  }
}
