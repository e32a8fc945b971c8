package hydrocascade.compute;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Punto de entrada del motor de cascadas.
 * <p>
 * Arranca el contexto de Spring Boot sin servidor web. Con argumentos {@code --cascade=...}
 * ejecuta una simulación desde ficheros JSON (ver {@code CascadeSimulationRunner}).
 */
@SpringBootApplication(scanBasePackages = "hydrocascade")
public class ComputeEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComputeEngineApplication.class, args);
    }
}
