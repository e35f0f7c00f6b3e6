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

import ai.floedb.nameguard.validation.NameAvailabilityService.Availability;
import ai.floedb.nameguard.validation.conflict.ConflictOutcome;
import ai.floedb.nameguard.validation.conflict.ConflictResolver;
import ai.floedb.nameguard.validation.model.ConflictStrategy;
import ai.floedb.nameguard.validation.model.ValidationRequest;
import ai.floedb.nameguard.validation.model.ValidationSettings;
import java.util.Random;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class NameAvailabilityServiceTest {
  private static final String VM = "Microsoft.Compute/virtualMachines";

  private final ValidationFixture fixture = new ValidationFixture();
  private final NameAvailabilityService service =
      new NameAvailabilityService(
          fixture.settings, fixture.validator, new ConflictResolver(), 4, new Random(11));

  @AfterEach
  void tearDown() {
    fixture.close();
  }

  @Test
  void autoIncrementResolvesToNextInstance() {
    fixture.store.settings =
        ValidationSettings.defaults()
            .withEnabled(true)
            .withConflictStrategy(ConflictStrategy.AUTO_INCREMENT);
    fixture.tenant.existing("vm-prod-eus2-app-001", "/vm/vm-prod-eus2-app-001");

    Availability availability =
        service.resolveAvailableName(new ValidationRequest("vm-prod-eus2-app-001", VM));

    assertThat(availability.strategy()).isEqualTo(ConflictStrategy.AUTO_INCREMENT);
    assertThat(availability.validation().existsInAzure()).isTrue();
    assertThat(availability.resolution().outcome()).isEqualTo(ConflictOutcome.AUTO_RESOLVED);
    assertThat(availability.resolution().finalName()).isEqualTo("vm-prod-eus2-app-002");
    assertThat(fixture.tenant.queryCount()).isEqualTo(2);
  }

  @Test
  void notifyOnlyIsTheDefault() {
    fixture.tenant.existing("vm-1", "/vm/vm-1");

    Availability availability = service.resolveAvailableName(new ValidationRequest("vm-1", VM));

    assertThat(availability.resolution().outcome()).isEqualTo(ConflictOutcome.CONFLICT);
    assertThat(availability.resolution().finalName()).isEqualTo("vm-1");
  }

  @Test
  void suffixStrategyUsesRandomSuffixMutator() {
    fixture.store.settings =
        ValidationSettings.defaults()
            .withEnabled(true)
            .withConflictStrategy(ConflictStrategy.SUFFIX_RANDOM);
    fixture.tenant.existing("stacct", "/sa/stacct");

    Availability availability =
        service.resolveAvailableName(
            new ValidationRequest("stacct", "Microsoft.Storage/storageAccounts"));

    assertThat(availability.resolution().outcome()).isEqualTo(ConflictOutcome.AUTO_RESOLVED);
    assertThat(availability.resolution().finalName()).matches("stacct[a-z0-9]{4}");
  }

  @Test
  void disabledValidationAcceptsCandidate() {
    fixture.globalSwitch.set(false);

    Availability availability = service.resolveAvailableName(new ValidationRequest("vm-1", VM));

    assertThat(availability.validation().validationPerformed()).isFalse();
    assertThat(availability.resolution().outcome()).isEqualTo(ConflictOutcome.ACCEPTED);
  }

  @Test
  void strategyAndRevalidationsShareOneSettingsRead() {
    fixture.store.settings =
        ValidationSettings.defaults()
            .withEnabled(true)
            .withConflictStrategy(ConflictStrategy.AUTO_INCREMENT);
    fixture.tenant.existing("vm-app-001", "/vm/vm-app-001");
    fixture.store.loads = 0;

    Availability availability =
        service.resolveAvailableName(new ValidationRequest("vm-app-001", VM));

    assertThat(availability.resolution().finalName()).isEqualTo("vm-app-002");
    assertThat(fixture.tenant.queryCount()).isEqualTo(2);
    assertThat(fixture.store.loads).isEqualTo(1);
  }

  @Test
  void globallyDisabledAcceptsWithoutQuerying() {
    fixture.globalSwitch.set(false);
    fixture.tenant.existing("vm-app-001", "/vm/vm-app-001");

    Availability availability =
        service.resolveAvailableName(new ValidationRequest("vm-app-001", VM));

    assertThat(availability.validation().validationPerformed()).isFalse();
    assertThat(availability.resolution().finalName()).isEqualTo("vm-app-001");
    assertThat(fixture.tenant.queryCount()).isZero();
  }
}
