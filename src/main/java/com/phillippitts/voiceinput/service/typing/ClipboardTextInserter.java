package com.phillippitts.voiceinput.service.typing;

import com.phillippitts.voiceinput.config.typing.TypingProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.AWTException;
import java.awt.GraphicsEnvironment;
import java.awt.Robot;
import java.awt.Toolkit;
import java.awt.datatransfer.Clipboard;
import java.awt.datatransfer.DataFlavor;
import java.awt.datatransfer.StringSelection;
import java.awt.datatransfer.UnsupportedFlavorException;
import java.awt.event.KeyEvent;
import java.io.IOException;
import java.util.Locale;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Inserts text by placing it on the system clipboard and sending the paste shortcut
 * through {@link Robot}. The previous clipboard text is put back after
 * {@code typing.restore-delay-ms} so the target application has read the new one first.
 */
class ClipboardTextInserter implements TextInserter {

    private static final Logger LOG = LogManager.getLogger(ClipboardTextInserter.class);

    interface ClipboardFacade {
        Clipboard getSystemClipboard();
    }

    interface RobotFacade {
        void keyPress(int keyCode);

        void keyRelease(int keyCode);

        void delay(int ms);
    }

    /** Creates a robot on demand; Robot construction fails on headless systems. */
    interface RobotFactory {
        RobotFacade create() throws AWTException;
    }

    static final class AwtRobotFacade implements RobotFacade {
        private final Robot robot;

        AwtRobotFacade() throws AWTException {
            this.robot = new Robot();
        }

        @Override
        public void keyPress(int keyCode) {
            robot.keyPress(keyCode);
        }

        @Override
        public void keyRelease(int keyCode) {
            robot.keyRelease(keyCode);
        }

        @Override
        public void delay(int ms) {
            robot.delay(ms);
        }
    }

    private final TypingProperties props;
    private final ClipboardFacade clipboard;
    private final RobotFactory robots;
    private final BooleanSupplier available;
    private final boolean mac;

    ClipboardTextInserter(TypingProperties props) {
        this(props, () -> Toolkit.getDefaultToolkit().getSystemClipboard(), AwtRobotFacade::new,
                () -> !GraphicsEnvironment.isHeadless(),
                System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("mac"));
    }

    // Package-private for tests
    ClipboardTextInserter(TypingProperties props, ClipboardFacade clipboard, RobotFactory robots,
                          BooleanSupplier available, boolean mac) {
        this.props = Objects.requireNonNull(props);
        this.clipboard = Objects.requireNonNull(clipboard);
        this.robots = Objects.requireNonNull(robots);
        this.available = Objects.requireNonNull(available);
        this.mac = mac;
    }

    @Override
    public boolean canInsert() {
        return available.getAsBoolean();
    }

    @Override
    public boolean insert(String text) {
        Clipboard cb = clipboard.getSystemClipboard();
        String prior = props.isRestoreClipboard() ? readText(cb) : null;
        try {
            cb.setContents(new StringSelection(text), null);
        } catch (IllegalStateException e) {
            // clipboard held by another application
            LOG.warn("Clipboard unavailable: {}", e.toString());
            return false;
        }
        RobotFacade robot;
        try {
            robot = robots.create();
        } catch (AWTException | SecurityException e) {
            LOG.warn("Robot unavailable; text left on the clipboard: {}", e.toString());
            return false;
        }
        robot.delay(props.getSettleDelayMs());
        pasteShortcut(robot);
        if (prior != null) {
            robot.delay(props.getRestoreDelayMs());
            try {
                cb.setContents(new StringSelection(prior), null);
            } catch (IllegalStateException e) {
                LOG.debug("Could not restore prior clipboard: {}", e.toString());
            }
        }
        return true;
    }

    @Override
    public String name() {
        return "clipboard";
    }

    void pasteShortcut(RobotFacade robot) {
        String mode = props.getPasteShortcut();
        int modKey = mac ? KeyEvent.VK_META : KeyEvent.VK_CONTROL;
        if ("META+V".equalsIgnoreCase(mode)) {
            modKey = KeyEvent.VK_META;
        } else if ("CONTROL+V".equalsIgnoreCase(mode)) {
            modKey = KeyEvent.VK_CONTROL;
        }
        robot.keyPress(modKey);
        robot.keyPress(KeyEvent.VK_V);
        robot.keyRelease(KeyEvent.VK_V);
        robot.keyRelease(modKey);
    }

    private static String readText(Clipboard cb) {
        try {
            if (cb.isDataFlavorAvailable(DataFlavor.stringFlavor)) {
                return (String) cb.getData(DataFlavor.stringFlavor);
            }
        } catch (UnsupportedFlavorException | IOException | IllegalStateException e) {
            LOG.debug("Prior clipboard unreadable: {}", e.toString());
        }
        return null;
    }
}
