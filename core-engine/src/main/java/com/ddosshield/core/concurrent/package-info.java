/**
 * Thread and executor helpers shared by the scoring, timer, dispatch and
 * pipeline components.
 */
package com.ddosshield.core.concurrent;
