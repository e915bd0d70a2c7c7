package io.controlplane.controlapi;

import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot context of the control API. Started by {@link ControlApi}, never standalone.
 */
@SpringBootApplication(scanBasePackageClasses = ControlApiApplication.class)
public class ControlApiApplication {
}
