/**
 * Logging support: request MDC population for Log4j2.
 */
package com.phillippitts.voiceorders.config.logging;
