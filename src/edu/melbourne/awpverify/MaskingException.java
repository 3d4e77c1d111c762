/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

/**
 * Raised when a masking target does not exist in the scenario it is applied
 * to.
 *
 * @author kafle
 */
public class MaskingException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public MaskingException(String message) {
        super(message);
    }
}
