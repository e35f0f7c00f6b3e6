/*
 * Copyright 2026 Yellowbrick Data, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.floedb.nameguard.validation.credentials;

import ai.floedb.nameguard.validation.concurrent.DaemonExecutors;
import ai.floedb.nameguard.validation.errors.AuthenticationException;
import ai.floedb.nameguard.validation.errors.SecretResolutionException;
import ai.floedb.nameguard.validation.model.AuthMode;
import ai.floedb.nameguard.validation.model.ValidationSettings;
import ai.floedb.nameguard.validation.model.ValidationSettings.ServicePrincipalSettings;
import ai.floedb.nameguard.validation.secrets.SecretProvider;
import ai.floedb.nameguard.validation.spi.TenantClient;
import ai.floedb.nameguard.validation.spi.TenantClientFactory;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.jboss.logging.Logger;

/**
 * Holds the single process-wide {@link AuthenticatedClient}.
 *
 * <p>Authentication is single-flight: the first caller that finds no client for the current
 * settings builds one under the lock and concurrent callers wait for it and reuse it. The live
 * client is replaced when the settings fingerprint changes or after {@link #invalidate()}.
 *
 * <p>Secret resolution and credential construction share one time budget. An overrun is
 * cancelled and reported as an {@link AuthenticationException}, which releases the lock for the
 * next caller.
 */
public class CredentialResolver implements AutoCloseable {
  private static final Logger LOG = Logger.getLogger(CredentialResolver.class);

  public static final Duration AUTH_TIMEOUT = Duration.ofSeconds(5);
  static final int AUTH_THREADS = 2;

  private final TenantClientFactory factory;
  private final SecretProvider secrets;
  private final Clock clock;
  private final Duration timeout;
  private final ExecutorService executor;
  private final ReentrantLock lock = new ReentrantLock();
  private volatile AuthenticatedClient current;

  public CredentialResolver(TenantClientFactory factory, SecretProvider secrets, Clock clock) {
    this(factory, secrets, clock, AUTH_TIMEOUT);
  }

  public CredentialResolver(
      TenantClientFactory factory, SecretProvider secrets, Clock clock, Duration timeout) {
    this(
        factory,
        secrets,
        clock,
        timeout,
        DaemonExecutors.bounded("credential-resolver", AUTH_THREADS));
  }

  CredentialResolver(
      TenantClientFactory factory,
      SecretProvider secrets,
      Clock clock,
      Duration timeout,
      ExecutorService executor) {
    this.factory = Objects.requireNonNull(factory, "factory");
    this.secrets = Objects.requireNonNull(secrets, "secrets");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("authentication timeout must be positive: " + timeout);
    }
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  public AuthenticatedClient ensureAuthenticated(ValidationSettings settings) {
    String fingerprint = SettingsFingerprint.of(settings);
    AuthenticatedClient live = current;
    if (live != null && live.matches(fingerprint)) {
      return live;
    }
    lock.lock();
    try {
      live = current;
      if (live != null && live.matches(fingerprint)) {
        return live;
      }
      AuthenticatedClient created = authenticateWithin(settings, fingerprint);
      current = created;
      LOG.infof("Tenant client authenticated using %s", created.mode());
      return created;
    } finally {
      lock.unlock();
    }
  }

  /** Drops the live client; the next validation re-authenticates. */
  public void invalidate() {
    lock.lock();
    try {
      if (current != null) {
        LOG.infof("Discarding %s tenant client", current.mode());
      }
      current = null;
    } finally {
      lock.unlock();
    }
  }

  public boolean clientPresent() {
    return current != null;
  }

  public Optional<AuthenticatedClient> currentClient() {
    return Optional.ofNullable(current);
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }

  private AuthenticatedClient authenticateWithin(ValidationSettings settings, String fingerprint) {
    AuthMode mode = settings.authMode();
    Future<AuthenticatedClient> pending;
    try {
      pending = executor.submit(() -> authenticate(settings, fingerprint));
    } catch (RejectedExecutionException e) {
      throw new AuthenticationException(mode, "no capacity left for credential acquisition");
    }
    try {
      return pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      pending.cancel(true);
      LOG.warnf("Credential acquisition using %s timed out after %d ms", mode, timeout.toMillis());
      throw new AuthenticationException(
          mode, "credential acquisition timed out after " + timeout.toMillis() + " ms");
    } catch (InterruptedException e) {
      pending.cancel(true);
      Thread.currentThread().interrupt();
      throw new AuthenticationException(mode, "credential acquisition was interrupted", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() == null ? e : e.getCause();
      if (cause instanceof AuthenticationException authError) {
        throw authError;
      }
      throw new AuthenticationException(
          mode, "credential acquisition failed (" + cause.getClass().getSimpleName() + ")");
    }
  }

  private AuthenticatedClient authenticate(ValidationSettings settings, String fingerprint) {
    AuthMode mode = settings.authMode();
    TenantClient client =
        switch (mode) {
          case MANAGED_IDENTITY -> build(mode, factory::managedIdentity, null);
          case SERVICE_PRINCIPAL -> servicePrincipal(settings);
        };
    return new AuthenticatedClient(mode, client, fingerprint, Instant.now(clock));
  }

  private TenantClient servicePrincipal(ValidationSettings settings) {
    AuthMode mode = AuthMode.SERVICE_PRINCIPAL;
    ServicePrincipalSettings principal = settings.servicePrincipal();
    if (principal == null) {
      throw new AuthenticationException(mode, "service principal settings are required");
    }
    if (settings.tenantId() == null) {
      throw new AuthenticationException(mode, "tenant id is required");
    }
    if (principal.clientId() == null) {
      throw new AuthenticationException(mode, "client id is required");
    }
    String secret;
    try {
      secret = secrets.resolveClientSecret(settings);
    } catch (SecretResolutionException e) {
      throw new AuthenticationException(mode, e.getMessage(), e);
    }
    return build(
        mode,
        () -> factory.servicePrincipal(settings.tenantId(), principal.clientId(), secret),
        secret);
  }

  private static TenantClient build(AuthMode mode, Supplier<TenantClient> supplier, String secret) {
    try {
      TenantClient client = supplier.get();
      if (client == null) {
        throw new AuthenticationException(mode, "credential factory returned no client");
      }
      return client;
    } catch (AuthenticationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new AuthenticationException(
          mode,
          "credential construction failed ("
              + e.getClass().getSimpleName()
              + "): "
              + redact(e.getMessage(), secret));
    }
  }

  private static String redact(String message, String secret) {
    if (message == null) {
      return "no detail";
    }
    if (secret == null || secret.isEmpty()) {
      return message;
    }
    return message.replace(secret, "<redacted>");
  }
}
