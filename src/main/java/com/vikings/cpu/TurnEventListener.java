package com.vikings.cpu;

/**
 * Observer of turn progress (rendering hosts, broadcasters, test drivers).
 */
public interface TurnEventListener {

    void onTurnEvent(TurnEvent event);
}
