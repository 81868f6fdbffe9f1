/**
 * Framework-free helpers shared by the engine: content hashing, blob addressing
 * and per-key locking.
 */
package com.libragraph.drive.util;
