package io.b2mash.collab.message;

import io.b2mash.collab.member.UserSummary;

/** One entry of the conversation list: the other party, their latest message, unread count. */
public record ConversationSummary(
    UserSummary user, PrivateMessageResponse lastMessage, long unreadCount) {}
