package com.keyaccess.domain.model;

/**
 * Acción resultante de un acceso concedido.
 */
public enum KeyAction {

    BORROW("borrow"),
    RETURN("return"),
    NONE("");

    private final String wireValue;

    KeyAction(String wireValue) {
        this.wireValue = wireValue;
    }

    /**
     * Valor enviado al controlador en el campo "action".
     */
    public String getWireValue() {
        return wireValue;
    }
}
