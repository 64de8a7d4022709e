/**
 * Spring Boot auto-configuration: a {@link io.syncevents.SyncClient} bean,
 * {@link io.syncevents.spring.boot.SyncEventHandler} method scanning and
 * Micrometer metrics.
 */
package io.syncevents.spring.boot;
