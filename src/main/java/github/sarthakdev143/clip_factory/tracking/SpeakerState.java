package github.sarthakdev143.clip_factory.tracking;

public enum SpeakerState {
    /** Not competing for the framing slot. */
    IDLE,
    /** Leading the frame signal, counting consecutive frames. */
    CANDIDATE,
    /** Current framing target, free to be challenged. */
    STABILIZED,
    /** Current framing target right after a switch; challenges are ignored. */
    COOLDOWN
}
