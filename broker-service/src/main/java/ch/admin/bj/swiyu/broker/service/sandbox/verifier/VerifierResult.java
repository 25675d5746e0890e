/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.service.sandbox.verifier;

import java.util.Map;

/**
 * Outcome of a finished verification, typed and as received for auditing.
 */
public record VerifierResult(VerifierResultDto result, Map<String, Object> rawData) {
}
