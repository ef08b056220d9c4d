package com.phillippitts.terrarium;

import com.phillippitts.terrarium.config.properties.ConfigProperties;
import com.phillippitts.terrarium.config.properties.MainLoopProperties;
import com.phillippitts.terrarium.config.properties.SafetyProperties;
import com.phillippitts.terrarium.config.properties.WatchdogProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Terrarium supervisor entry point.
 *
 * <p>SIGINT/SIGTERM close the application context through Spring Boot's JVM shutdown hook, which
 * stops the control loop and the watchdog. The shutdown is graceful, but the process exit status is
 * the JVM's signal status (130 for SIGINT, 143 for SIGTERM), not 0. Service managers should treat
 * those as a clean stop (systemd: {@code SuccessExitStatus=130 143}).
 */
@SpringBootApplication
@EnableConfigurationProperties({
        MainLoopProperties.class,
        WatchdogProperties.class,
        SafetyProperties.class,
        ConfigProperties.class
})
public class TerrariumApplication {

    public static void main(String[] args) {
        SpringApplication.run(TerrariumApplication.class, args);
    }
}
