/**
 * Main application class for the content SEO service
 *
 * Features:
 * - Hosts the admin SEO scoring endpoints
 * - Reads published posts through JDBC for internal link suggestions
 * - Entry point for Spring Boot application
 */

package net.contentseo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ContentSeoApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(ContentSeoApplication.class, args);
    }
}
