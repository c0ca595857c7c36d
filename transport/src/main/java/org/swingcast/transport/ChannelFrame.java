package org.swingcast.transport;

public class ChannelFrame {
    public enum Command { HELLO, MESSAGE, PING }

    public Command cmd;
    public String peer;
    public byte[] payload;

    public ChannelFrame() {
    }

    public static ChannelFrame hello(String peer) {
        ChannelFrame frame = new ChannelFrame();
        frame.cmd = Command.HELLO;
        frame.peer = peer;
        return frame;
    }

    public static ChannelFrame ping() {
        ChannelFrame frame = new ChannelFrame();
        frame.cmd = Command.PING;
        return frame;
    }

    public static ChannelFrame message(byte[] payload) {
        ChannelFrame frame = new ChannelFrame();
        frame.cmd = Command.MESSAGE;
        frame.payload = payload;
        return frame;
    }
}
