/**
 * Sharded per-source mitigation state with atomic transitions and bounded
 * size.
 */
package com.ddosshield.core.state;
