/**
 * Pure Java value types shared across all Drive modules.
 *
 * <p>Enums here carry a stable numeric id for persistence and a lowercase label
 * for display. This module has no framework dependencies.
 */
package com.libragraph.drive.types;
