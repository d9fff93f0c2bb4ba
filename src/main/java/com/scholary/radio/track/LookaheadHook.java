package com.scholary.radio.track;

import java.util.Optional;

/**
 * Called by a playlist for every candidate it is about to buffer as an upcoming item.
 *
 * <p>Returning a resolved request accepts the candidate; returning empty rejects it and the
 * playlist moves on to another one.
 */
@FunctionalInterface
public interface LookaheadHook {

  LookaheadHook ACCEPT_ALL = Optional::of;

  Optional<PlayoutRequest> check(PlayoutRequest candidate);
}
