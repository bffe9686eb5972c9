package com.parichay.api.moderation;

import com.parichay.core.domain.ModerationLog;

import java.util.Optional;

public record AppealOutcome(ModerationLog entry, Optional<ReversalIntent> reversal) {}
