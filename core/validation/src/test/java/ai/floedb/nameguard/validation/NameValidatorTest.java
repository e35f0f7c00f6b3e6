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

package ai.floedb.nameguard.validation;

import static org.assertj.core.api.Assertions.assertThat;

import ai.floedb.nameguard.validation.model.AuthMode;
import ai.floedb.nameguard.validation.model.ValidationRequest;
import ai.floedb.nameguard.validation.model.ValidationResult;
import ai.floedb.nameguard.validation.model.ValidationSettings;
import ai.floedb.nameguard.validation.model.ValidationSettings.CacheSettings;
import ai.floedb.nameguard.validation.model.ValidationSettings.SecretStoreSettings;
import ai.floedb.nameguard.validation.model.ValidationSettings.ServicePrincipalSettings;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class NameValidatorTest {
  private static final String STORAGE = "Microsoft.Storage/storageAccounts";
  private static final String STORAGE_ID =
      "/subscriptions/sub-1/resourceGroups/rg/providers/" + STORAGE + "/storageacct01";

  private ValidationFixture fixture = new ValidationFixture();

  @AfterEach
  void tearDown() {
    fixture.close();
  }

  @Test
  void globallyDisabledTouchesNothing() {
    fixture.globalSwitch.set(false);

    ValidationResult result = fixture.validator.validate("storageacct01", STORAGE);

    assertThat(result.validationPerformed()).isFalse();
    assertThat(result.existsInAzure()).isFalse();
    assertThat(result.timestamp()).isEqualTo(ValidationFixture.NOW);
    assertThat(fixture.factory.authentications()).isZero();
    assertThat(fixture.tenant.queryCount()).isZero();
    assertThat(fixture.cache.estimatedSize()).isZero();
  }

  @Test
  void tenantDisabledTouchesNothing() {
    fixture.store.settings = ValidationSettings.defaults();

    ValidationResult result = fixture.validator.validate("storageacct01", STORAGE);

    assertThat(result.validationPerformed()).isFalse();
    assertThat(result.warning()).isNull();
    assertThat(fixture.factory.authentications()).isZero();
    assertThat(fixture.tenant.queryCount()).isZero();
  }

  @Test
  void secondValidationIsServedFromCache() {
    fixture.tenant.existing("storageacct01", STORAGE_ID);

    ValidationResult first = fixture.validator.validate("storageacct01", STORAGE);
    ValidationResult second = fixture.validator.validate("storageacct01", STORAGE);

    assertThat(first.validationPerformed()).isTrue();
    assertThat(first.existsInAzure()).isTrue();
    assertThat(first.conflictingResourceIds()).containsExactly(STORAGE_ID);
    assertThat(second).isEqualTo(first);
    assertThat(fixture.tenant.queryCount()).isEqualTo(1);
  }

  @Test
  void notFoundIsCachedToo() {
    ValidationResult first = fixture.validator.validate("freshname01", STORAGE);
    fixture.validator.validate("freshname01", STORAGE);

    assertThat(first.validationPerformed()).isTrue();
    assertThat(first.existsInAzure()).isFalse();
    assertThat(first.conflictingResourceIds()).isEmpty();
    assertThat(fixture.tenant.queryCount()).isEqualTo(1);
  }

  @Test
  void cacheSwitchOffQueriesEveryTime() {
    fixture.store.settings =
        new ValidationSettings(
            true, null, null, Set.of(), null, null, new CacheSettings(false, 60), null, Set.of());

    fixture.validator.validate("storageacct01", STORAGE);
    fixture.validator.validate("storageacct01", STORAGE);

    assertThat(fixture.tenant.queryCount()).isEqualTo(2);
    assertThat(fixture.cache.estimatedSize()).isZero();
  }

  @Test
  void settingsUpdateInvalidatesCacheAndClient() {
    fixture.validator.validate("storageacct01", STORAGE);

    fixture.settings.update(ValidationSettings.defaults().withEnabled(true));
    fixture.validator.validate("storageacct01", STORAGE);

    assertThat(fixture.tenant.queryCount()).isEqualTo(2);
    assertThat(fixture.factory.authentications()).isEqualTo(2);
  }

  @Test
  void excludedTypeIsNotValidated() {
    fixture.store.settings =
        new ValidationSettings(
            true,
            null,
            null,
            Set.of(),
            null,
            null,
            null,
            null,
            Set.of("microsoft.storage/storageaccounts"));

    ValidationResult result =
        fixture.validator.validate(new ValidationRequest("storageacct01", STORAGE));

    assertThat(result.validationPerformed()).isFalse();
    assertThat(result.warning()).isNull();
    assertThat(fixture.tenant.queryCount()).isZero();
  }

  @Test
  void timeoutDegradesToWarning() {
    fixture.close();
    fixture =
        new ValidationFixture(
            ValidationSettings.defaults().withEnabled(true), Duration.ofMillis(50));
    fixture.tenant.responder =
        query -> {
          try {
            Thread.sleep(5_000);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          return List.of();
        };

    ValidationResult result = fixture.validator.validate("storageacct01", STORAGE);

    assertThat(result.validationPerformed()).isFalse();
    assertThat(result.existsInAzure()).isFalse();
    assertThat(result.warning()).startsWith("Validation error:").contains("timed out");
    assertThat(fixture.cache.get(STORAGE, "storageacct01")).isEmpty();
  }

  @Test
  void authenticationFailureDegradesToWarning() {
    fixture.factory.failure = new IllegalStateException("no managed identity endpoint");

    ValidationResult result = fixture.validator.validate("storageacct01", STORAGE);

    assertThat(result.validationPerformed()).isFalse();
    assertThat(result.warning())
        .startsWith("Validation error:")
        .contains("MANAGED_IDENTITY")
        .contains("no managed identity endpoint");
    assertThat(fixture.tenant.queryCount()).isZero();
  }

  @Test
  void slowVaultIsCutOffByTheAuthenticationBudget() {
    ValidationSettings vaultBacked =
        new ValidationSettings(
            true,
            AuthMode.SERVICE_PRINCIPAL,
            "tenant-a",
            Set.of(),
            new ServicePrincipalSettings("client-1", null, null),
            new SecretStoreSettings("https://kv.vault.azure.net/", "sp-secret"),
            null,
            null,
            Set.of());
    fixture.close();
    fixture = new ValidationFixture(vaultBacked, Duration.ofSeconds(2), Duration.ofMillis(200));
    fixture.vault.secrets.put("sp-secret", "from-vault");
    fixture.vault.delayMillis = 4_000;

    long started = System.nanoTime();
    ValidationResult result = fixture.validator.validate("storageacct01", STORAGE);
    long elapsedMillis = (System.nanoTime() - started) / 1_000_000;

    assertThat(elapsedMillis).isLessThan(1_000);
    assertThat(result.validationPerformed()).isFalse();
    assertThat(result.warning())
        .startsWith("Validation error:")
        .contains("SERVICE_PRINCIPAL")
        .contains("timed out");
    assertThat(fixture.credentials.clientPresent()).isFalse();

    fixture.vault.delayMillis = 0;
    ValidationResult retried = fixture.validator.validate("storageacct01", STORAGE);

    assertThat(retried.validationPerformed()).isTrue();
    assertThat(fixture.factory.lastClientSecret).isEqualTo("from-vault");
  }

  @Test
  void failureWithoutMessageNamesTheExceptionType() {
    fixture.tenant.responder =
        query -> {
          throw new IllegalStateException();
        };

    ValidationResult result = fixture.validator.validate("storageacct01", STORAGE);

    assertThat(result.validationPerformed()).isFalse();
    assertThat(result.warning())
        .startsWith("Validation error:")
        .contains("IllegalStateException")
        .doesNotContain("null");
  }

  @Test
  void describeFallsBackToTheExceptionType() {
    assertThat(NameValidator.describe(new IllegalStateException("boom"))).isEqualTo("boom");
    assertThat(NameValidator.describe(new IllegalStateException()))
        .isEqualTo("IllegalStateException");
    assertThat(NameValidator.describe(new RuntimeException(" "))).isEqualTo("RuntimeException");
  }
}
