/**
 * Event-type vocabulary: structural categories, routing kinds, registry tags and
 * the table of statically known types.
 *
 * @see io.syncevents.event.EventTypes
 * @see io.syncevents.event.EventTypeTable
 */
package io.syncevents.event;
