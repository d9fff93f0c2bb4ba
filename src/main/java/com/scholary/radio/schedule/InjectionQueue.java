package com.scholary.radio.schedule;

import com.scholary.radio.playout.RequestSource;
import com.scholary.radio.track.PlayoutRequest;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Generated segments waiting to be spliced into the stream.
 *
 * <p>Workers push as they finish; the playout loop takes items in push order. Push order is
 * completion order, which is not necessarily the order the batches were triggered in.
 */
@Component
public class InjectionQueue implements RequestSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(InjectionQueue.class);

  private final Queue<PlayoutRequest> queue = new ConcurrentLinkedQueue<>();

  public void push(PlayoutRequest request) {
    queue.add(request);
    LOGGER.debug("Queued for injection: {} (queue size {})", request.file(), queue.size());
  }

  @Override
  public Optional<PlayoutRequest> next() {
    return Optional.ofNullable(queue.poll());
  }

  public int size() {
    return queue.size();
  }

  public boolean isEmpty() {
    return queue.isEmpty();
  }
}
