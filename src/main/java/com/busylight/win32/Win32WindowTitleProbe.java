package com.busylight.win32;

import com.busylight.probe.ProbeException;
import com.busylight.probe.WindowTitleProbe;
import com.sun.jna.Platform;
import com.sun.jna.platform.win32.Kernel32;
import com.sun.jna.platform.win32.User32;
import com.sun.jna.platform.win32.WinDef.HWND;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Window-title probe backed by User32 window enumeration.
 *
 * <p>On other platforms there are no windows to enumerate and the source simply stays
 * inactive.
 */
public class Win32WindowTitleProbe extends WindowTitleProbe {

    private static final Logger log = LoggerFactory.getLogger(Win32WindowTitleProbe.class);

    private static final int WINDOW_TITLE_MAX_CHARS = 1024;

    private final boolean supported;

    public Win32WindowTitleProbe(List<String> keywords) {
        super(keywords);
        this.supported = Platform.isWindows();
        if (!supported) {
            log.warn("Window title probes need Windows; {} will never become active", keywords);
        }
    }

    @Override
    protected List<String> visibleWindowTitles() throws ProbeException {
        if (!supported) {
            return List.of();
        }
        List<String> titles = new ArrayList<>();
        boolean completed;
        try {
            completed = User32.INSTANCE.EnumWindows((hwnd, data) -> {
                if (User32.INSTANCE.IsWindowVisible(hwnd)) {
                    String title = readWindowTitle(hwnd);
                    if (title != null && !title.isBlank()) {
                        titles.add(title);
                    }
                }
                return true;
            }, null);
        } catch (RuntimeException | LinkageError ex) {
            throw new ProbeException("EnumWindows failed", ex);
        }
        if (!completed) {
            int error = Kernel32.INSTANCE.GetLastError();
            throw new ProbeException("EnumWindows failed with error " + error);
        }
        return titles;
    }

    private String readWindowTitle(HWND hwnd) {
        char[] buffer = new char[WINDOW_TITLE_MAX_CHARS];
        int length = User32.INSTANCE.GetWindowText(hwnd, buffer, buffer.length);
        if (length <= 0) {
            return null;
        }
        return new String(buffer, 0, length);
    }
}
