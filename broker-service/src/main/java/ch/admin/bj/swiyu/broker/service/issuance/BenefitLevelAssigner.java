/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.issuance;

/**
 * Decides the benefit level written into a newly offered credential.
 */
public interface BenefitLevelAssigner {

    /**
     * Level used for templates without defined levels.
     */
    String NO_LEVEL = "NA";

    String assign(Integer templateId);
}
