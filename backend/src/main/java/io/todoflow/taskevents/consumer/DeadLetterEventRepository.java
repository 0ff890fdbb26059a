package io.todoflow.taskevents.consumer;

import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface DeadLetterEventRepository extends JpaRepository<DeadLetterEvent, UUID> {

  List<DeadLetterEvent> findByConsumerIdOrderByCreatedAtAsc(String consumerId);
}
