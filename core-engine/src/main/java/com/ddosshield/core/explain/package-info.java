/**
 * Attribution of flagged verdicts to features, and attack-family labelling
 * for alerts.
 */
package com.ddosshield.core.explain;
