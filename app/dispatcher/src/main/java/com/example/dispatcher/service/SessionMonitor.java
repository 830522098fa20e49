/*
 * Where: Dispatcher service layer (UserMonitor/VerifyLoginStatus)
 * What: Flips users whose online flag went stale to offline
 * Why: Keep presence accurate when clients disappear without logging out
 */
package com.example.dispatcher.service;

import com.example.dispatcher.config.SessionMonitorProperties;
import com.example.dispatcher.queue.JobContext;
import com.example.dispatcher.queue.JobHandler;
import com.example.dispatcher.queue.JobType;
import com.example.dispatcher.queue.VerifyLoginStatusPayload;
import com.example.dispatcher.repository.UserRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SessionMonitor implements JobHandler<VerifyLoginStatusPayload> {

  private static final Logger logger = LoggerFactory.getLogger(SessionMonitor.class);
  static final String ERROR_CONTEXT = "UserMonitor -> VerifyLoginStatus";

  private final UserRepository userRepository;
  private final SessionMonitorProperties properties;
  private final ErrorReporter errorReporter;
  private final Clock clock;

  @Override
  public JobType jobType() {
    return JobType.VERIFY_LOGIN_STATUS;
  }

  @Override
  public Class<VerifyLoginStatusPayload> payloadType() {
    return VerifyLoginStatusPayload.class;
  }

  @Override
  public void handle(VerifyLoginStatusPayload payload, JobContext context) {
    Instant now = Instant.now(clock);
    List<Long> stale = userRepository.findStaleOnlineUserIds(now.minus(properties.staleAfter()));
    for (Long userId : stale) {
      try {
        if (userRepository.markOffline(userId, now) > 0) {
          logger.info("user marked offline userId={}", userId);
        }
      } catch (RuntimeException ex) {
        errorReporter.report(ERROR_CONTEXT, ex);
      }
    }
  }
}
