package com.termcode.controllers;

import io.javalin.Javalin;

import java.util.Map;

/**
 * Interface for API controllers.
 * Each controller registers its routes with the Javalin app.
 */
public interface Controller {

    void registerRoutes(Javalin app);

    /**
     * Error body that tolerates exceptions without a message.
     */
    static Map<String, Object> errorBody(Exception e) {
        String m = e.getMessage();
        if (m == null || m.isBlank()) {
            m = e.getClass().getSimpleName();
        }
        return Map.of("error", m);
    }
}
