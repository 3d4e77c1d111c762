/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package edu.melbourne.awpverify;

/**
 * Kinds of quantity a masking target can hide.
 *
 * @author kafle
 */
public enum MaskingType {
    NONE,
    INITIAL_COUNT,
    FINAL_COUNT,
    QUANTITY_SUBSTITUTION
}
