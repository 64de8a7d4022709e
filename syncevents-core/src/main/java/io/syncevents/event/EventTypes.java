package io.syncevents.event;

import static io.syncevents.event.EventKind.CUSTOM;
import static io.syncevents.event.EventKind.EPHEMERAL;
import static io.syncevents.event.EventKind.GLOBAL_ACCOUNT_DATA;
import static io.syncevents.event.EventKind.MESSAGE;
import static io.syncevents.event.EventKind.NOTIFICATION;
import static io.syncevents.event.EventKind.PRESENCE;
import static io.syncevents.event.EventKind.ROOM_ACCOUNT_DATA;
import static io.syncevents.event.EventKind.STATE;
import static io.syncevents.event.EventKind.STRIPPED_STATE;

/**
 * Tags of the statically known protocol event types.
 *
 * <p>Every constant here is a row of {@link EventTypeTable#defaults()}.
 * {@link #CUSTOM} is the single tag under which all unrecognized events are
 * delivered, together with a {@link CustomEventKind} discriminator.
 */
public final class EventTypes {

  private EventTypes() {
  }

  // Global account data
  public static final EventTag IGNORED_USER_LIST = EventTag.of(GLOBAL_ACCOUNT_DATA, "m.ignored_user_list");
  public static final EventTag PUSH_RULES = EventTag.of(GLOBAL_ACCOUNT_DATA, "m.push_rules");
  public static final EventTag DIRECT = EventTag.of(GLOBAL_ACCOUNT_DATA, "m.direct");

  // Room account data
  public static final EventTag FULLY_READ = EventTag.of(ROOM_ACCOUNT_DATA, "m.fully_read");
  public static final EventTag TAG = EventTag.of(ROOM_ACCOUNT_DATA, "m.tag");

  // Ephemeral
  public static final EventTag TYPING = EventTag.of(EPHEMERAL, "m.typing");
  public static final EventTag RECEIPT = EventTag.of(EPHEMERAL, "m.receipt");

  // State
  public static final EventTag ROOM_MEMBER = EventTag.of(STATE, "m.room.member");
  public static final EventTag ROOM_NAME = EventTag.of(STATE, "m.room.name");
  public static final EventTag ROOM_ALIASES = EventTag.of(STATE, "m.room.aliases");
  public static final EventTag ROOM_AVATAR = EventTag.of(STATE, "m.room.avatar");
  public static final EventTag ROOM_POWER_LEVELS = EventTag.of(STATE, "m.room.power_levels");
  public static final EventTag ROOM_JOIN_RULES = EventTag.of(STATE, "m.room.join_rules");
  public static final EventTag ROOM_CANONICAL_ALIAS = EventTag.of(STATE, "m.room.canonical_alias");
  public static final EventTag ROOM_TOMBSTONE = EventTag.of(STATE, "m.room.tombstone");
  public static final EventTag ROOM_CREATE = EventTag.of(STATE, "m.room.create");
  public static final EventTag ROOM_ENCRYPTION = EventTag.of(STATE, "m.room.encryption");
  public static final EventTag ROOM_GUEST_ACCESS = EventTag.of(STATE, "m.room.guest_access");
  public static final EventTag ROOM_HISTORY_VISIBILITY = EventTag.of(STATE, "m.room.history_visibility");
  public static final EventTag ROOM_PINNED_EVENTS = EventTag.of(STATE, "m.room.pinned_events");
  public static final EventTag ROOM_SERVER_ACL = EventTag.of(STATE, "m.room.server_acl");
  public static final EventTag ROOM_THIRD_PARTY_INVITE = EventTag.of(STATE, "m.room.third_party_invite");
  public static final EventTag ROOM_TOPIC = EventTag.of(STATE, "m.room.topic");
  public static final EventTag SPACE_CHILD = EventTag.of(STATE, "m.space.child");
  public static final EventTag SPACE_PARENT = EventTag.of(STATE, "m.space.parent");
  public static final EventTag POLICY_RULE_ROOM = EventTag.of(STATE, "m.policy.rule.room");
  public static final EventTag POLICY_RULE_SERVER = EventTag.of(STATE, "m.policy.rule.server");
  public static final EventTag POLICY_RULE_USER = EventTag.of(STATE, "m.policy.rule.user");

  // Message (timeline, no state_key)
  public static final EventTag ROOM_MESSAGE = EventTag.of(MESSAGE, "m.room.message");
  public static final EventTag ROOM_MESSAGE_FEEDBACK = EventTag.of(MESSAGE, "m.room.message.feedback");
  public static final EventTag ROOM_REDACTION = EventTag.of(MESSAGE, "m.room.redaction");
  public static final EventTag REACTION = EventTag.of(MESSAGE, "m.reaction");
  public static final EventTag CALL_INVITE = EventTag.of(MESSAGE, "m.call.invite");
  public static final EventTag CALL_ANSWER = EventTag.of(MESSAGE, "m.call.answer");
  public static final EventTag CALL_CANDIDATES = EventTag.of(MESSAGE, "m.call.candidates");
  public static final EventTag CALL_HANGUP = EventTag.of(MESSAGE, "m.call.hangup");
  public static final EventTag KEY_VERIFICATION_READY = EventTag.of(MESSAGE, "m.key.verification.ready");
  public static final EventTag KEY_VERIFICATION_START = EventTag.of(MESSAGE, "m.key.verification.start");
  public static final EventTag KEY_VERIFICATION_CANCEL = EventTag.of(MESSAGE, "m.key.verification.cancel");
  public static final EventTag KEY_VERIFICATION_ACCEPT = EventTag.of(MESSAGE, "m.key.verification.accept");
  public static final EventTag KEY_VERIFICATION_KEY = EventTag.of(MESSAGE, "m.key.verification.key");
  public static final EventTag KEY_VERIFICATION_MAC = EventTag.of(MESSAGE, "m.key.verification.mac");
  public static final EventTag KEY_VERIFICATION_DONE = EventTag.of(MESSAGE, "m.key.verification.done");
  public static final EventTag ROOM_ENCRYPTED = EventTag.of(MESSAGE, "m.room.encrypted");
  public static final EventTag STICKER = EventTag.of(MESSAGE, "m.sticker");

  // Stripped state (invited rooms)
  public static final EventTag STRIPPED_ROOM_MEMBER = EventTag.of(STRIPPED_STATE, "m.room.member");
  public static final EventTag STRIPPED_ROOM_NAME = EventTag.of(STRIPPED_STATE, "m.room.name");
  public static final EventTag STRIPPED_ROOM_CANONICAL_ALIAS = EventTag.of(STRIPPED_STATE, "m.room.canonical_alias");
  public static final EventTag STRIPPED_ROOM_ALIASES = EventTag.of(STRIPPED_STATE, "m.room.aliases");
  public static final EventTag STRIPPED_ROOM_AVATAR = EventTag.of(STRIPPED_STATE, "m.room.avatar");
  public static final EventTag STRIPPED_ROOM_POWER_LEVELS = EventTag.of(STRIPPED_STATE, "m.room.power_levels");
  public static final EventTag STRIPPED_ROOM_JOIN_RULES = EventTag.of(STRIPPED_STATE, "m.room.join_rules");

  public static final EventTag PRESENCE_EVENT = EventTag.of(PRESENCE, "m.presence");

  /**
   * Push-rule output. Not a protocol event: the push-rule evaluator wraps the
   * matching timeline event as {@code {"actions": [...], "event": {...}, ...}}.
   */
  public static final EventTag ROOM_NOTIFICATION = EventTag.of(NOTIFICATION, "m.notification");

  public static final EventTag CUSTOM_EVENT = EventTag.of(CUSTOM, "*");
}
