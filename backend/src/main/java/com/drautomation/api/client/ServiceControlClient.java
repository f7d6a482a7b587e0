package com.drautomation.api.client;

/**
 * Restarts the services brought back during disaster recovery and checks their health.
 */
public interface ServiceControlClient {

    boolean isManaged(String service);

    void restartService(String service);

    boolean isHealthy(String service);
}
