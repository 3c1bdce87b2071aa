package queuectl.worker;

import java.io.IOException;

public interface WorkerLauncher {

    long launch(int ordinal) throws IOException;
}
