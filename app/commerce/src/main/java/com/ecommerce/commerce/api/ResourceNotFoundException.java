/*
 * どこで: Commerce API
 * 何を: 対象リソースが存在しない(404)ことを表す例外を定義する
 */
package com.ecommerce.commerce.api;

public class ResourceNotFoundException extends RuntimeException {

  public ResourceNotFoundException(String resource, long id) {
    super(resource + " with ID " + id + " not found");
  }

  public ResourceNotFoundException(String message) {
    super(message);
  }
}
