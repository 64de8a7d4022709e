/**
 * Structural classification of sync envelopes into routing tags.
 */
package io.syncevents.classify;
