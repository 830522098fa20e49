/*
 * どこで: ジョブキュー基盤
 * 何を: locked_by に記録するワーカー識別子を解決する
 * なぜ: lease 所有者を特定し、ロック喪失後の更新を弾くため
 */
package com.example.dispatcher.queue;

import java.net.InetAddress;
import java.net.UnknownHostException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class WorkerIdentity {

  private static final Logger logger = LoggerFactory.getLogger(WorkerIdentity.class);
  private static final String HOSTNAME_ENV = "HOSTNAME";
  private static final String DEFAULT_HOSTNAME = "unknown-host";

  private final String lockedBy;

  public WorkerIdentity() {
    this.lockedBy = resolveHostname() + ":" + ProcessHandle.current().pid();
  }

  public String lockedBy() {
    return lockedBy;
  }

  private static String resolveHostname() {
    String env = System.getenv(HOSTNAME_ENV);
    if (env != null && !env.isBlank()) {
      return env;
    }
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException | SecurityException ex) {
      logger.warn("failed to resolve hostname; fallback to {}", DEFAULT_HOSTNAME, ex);
      return DEFAULT_HOSTNAME;
    }
  }
}
