package com.conveyal.otpdriver.setup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.net.URI;

/** Opens a URL for the user, typically the web interface of an OTP that just finished loading. */
public interface BrowserLauncher {

    void open (URI uri);

    /**
     * Opens the URL in the default desktop browser. On headless machines and desktops without browse support the URL
     * is only logged, since failing to open a browser is no reason to fail a launch that otherwise succeeded.
     */
    class DesktopBrowserLauncher implements BrowserLauncher {

        private static final Logger LOG = LoggerFactory.getLogger(DesktopBrowserLauncher.class);

        @Override
        public void open (URI uri) {
            if (GraphicsEnvironment.isHeadless() || !Desktop.isDesktopSupported()
                    || !Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
                LOG.info("No desktop browser available, open {} yourself.", uri);
                return;
            }
            try {
                Desktop.getDesktop().browse(uri);
            } catch (IOException | UnsupportedOperationException e) {
                LOG.warn("Could not open {} in a browser: {}", uri, e.getMessage());
            }
        }
    }

}
