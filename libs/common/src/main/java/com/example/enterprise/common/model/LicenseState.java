/*
 * どこで: common のライセンス状態定義
 * 何を: enterprise ライセンスの導出状態を列挙する
 * なぜ: サーバとクライアントで同一の状態値を共有するため
 */
package com.example.enterprise.common.model;

public enum LicenseState {
  NONE,
  ACTIVE,
  EXPIRED
}
