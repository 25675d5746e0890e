/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.issuance;

import ch.admin.bj.swiyu.broker.common.config.ApplicationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Simulation stand-in: picks one of the configured candidate levels of the template at random.
 */
@Component
@RequiredArgsConstructor
public class RandomBenefitLevelAssigner implements BenefitLevelAssigner {

    private final ApplicationProperties applicationProperties;

    @Override
    public String assign(Integer templateId) {
        var candidates = applicationProperties.getBenefitLevels().get(templateId);
        if (candidates == null || candidates.isEmpty()) {
            return NO_LEVEL;
        }
        return candidates.get(ThreadLocalRandom.current().nextInt(candidates.size()));
    }
}
