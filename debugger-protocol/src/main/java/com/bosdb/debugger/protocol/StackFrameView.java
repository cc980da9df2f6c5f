package com.bosdb.debugger.protocol;

import com.bosdb.debugger.session.StackFrame;

public record StackFrameView(int id, String name, Integer lineNumber, String procedureId) {

    public static StackFrameView from(StackFrame frame) {
        return new StackFrameView(frame.id(), frame.name(), frame.lineNumber(), frame.procedureId());
    }
}
