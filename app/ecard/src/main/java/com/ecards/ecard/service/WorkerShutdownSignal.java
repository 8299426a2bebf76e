package com.ecards.ecard.service;

import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Flipped once when the application context starts closing; workers stop picking up new units. */
@Component
public class WorkerShutdownSignal {

  private static final Logger logger = LoggerFactory.getLogger(WorkerShutdownSignal.class);

  private final AtomicBoolean stopping = new AtomicBoolean(false);

  @EventListener(ContextClosedEvent.class)
  public void onContextClosed() {
    if (stopping.compareAndSet(false, true)) {
      logger.info("worker shutdown requested");
    }
  }

  public boolean isStopping() {
    return stopping.get();
  }

  void requestStop() {
    stopping.set(true);
  }
}
