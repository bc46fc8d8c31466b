package com.questrail.pvstream.display;

/**
 * Run state of the display pump. A paused pump leaves the queue alone, so
 * frames published meanwhile overwrite each other and only the latest one is
 * shown on resume.
 */
public enum PumpState {
    RUNNING,
    PAUSED
}
